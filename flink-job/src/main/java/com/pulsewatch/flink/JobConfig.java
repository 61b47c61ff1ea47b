package com.pulsewatch.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable deployment configuration of the PulseWatch Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job is
 * configured through Kubernetes Deployment env vars, Docker {@code -e} flags
 * or a shell environment. Analytics settings (baselines, thresholds, SLOs)
 * live in the YAML file named by {@code ANALYTICS_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaGroupId;
    private final String metricsTopic;
    private final String logsTopic;
    /** Pre-aggregated SLO counts; blank disables the source. */
    private final String sloCountsTopic;
    private final String anomaliesTopic;
    private final String templatesTopic;
    private final String occurrencesTopic;
    private final String sloMeasurementsTopic;
    private final String sloStatusTopic;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;

    // ---------------------------------------------------------------
    // Analytics / health
    // ---------------------------------------------------------------
    private final String analyticsConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaGroupId = b.kafkaGroupId;
        this.metricsTopic = b.metricsTopic;
        this.logsTopic = b.logsTopic;
        this.sloCountsTopic = b.sloCountsTopic;
        this.anomaliesTopic = b.anomaliesTopic;
        this.templatesTopic = b.templatesTopic;
        this.occurrencesTopic = b.occurrencesTopic;
        this.sloMeasurementsTopic = b.sloMeasurementsTopic;
        this.sloStatusTopic = b.sloStatusTopic;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.maxOutOfOrdernessMs = b.maxOutOfOrdernessMs;
        this.analyticsConfigPath = b.analyticsConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory, resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return from(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map.
     */
    static JobConfig from(Map<String, String> variables) {
        Function<String, String> lookup = variables::get;
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaGroupId(env(lookup, "KAFKA_GROUP_ID", "pulsewatch"))
                    .metricsTopic(env(lookup, "KAFKA_METRICS_TOPIC", "metric-samples"))
                    .logsTopic(env(lookup, "KAFKA_LOGS_TOPIC", "log-records"))
                    .sloCountsTopic(env(lookup, "KAFKA_SLO_COUNTS_TOPIC", ""))
                    .anomaliesTopic(env(lookup, "KAFKA_ANOMALIES_TOPIC", "anomalies"))
                    .templatesTopic(env(lookup, "KAFKA_TEMPLATES_TOPIC", "log-templates"))
                    .occurrencesTopic(env(lookup, "KAFKA_OCCURRENCES_TOPIC", "log-occurrences"))
                    .sloMeasurementsTopic(env(lookup, "KAFKA_SLO_MEASUREMENTS_TOPIC", "slo-measurements"))
                    .sloStatusTopic(env(lookup, "KAFKA_SLO_STATUS_TOPIC", "slo-status"))
                    .parallelism(Integer.parseInt(env(lookup, "FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env(lookup, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .maxOutOfOrdernessMs(Long.parseLong(env(lookup, "MAX_OUT_OF_ORDERNESS_MS", "5000")))
                    .analyticsConfigPath(env(lookup, "ANALYTICS_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(env(lookup, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public String getMetricsTopic() {
        return metricsTopic;
    }

    public String getLogsTopic() {
        return logsTopic;
    }

    public String getSloCountsTopic() {
        return sloCountsTopic;
    }

    public boolean hasSloCountsTopic() {
        return !sloCountsTopic.isBlank();
    }

    public String getAnomaliesTopic() {
        return anomaliesTopic;
    }

    public String getTemplatesTopic() {
        return templatesTopic;
    }

    public String getOccurrencesTopic() {
        return occurrencesTopic;
    }

    public String getSloMeasurementsTopic() {
        return sloMeasurementsTopic;
    }

    public String getSloStatusTopic() {
        return sloStatusTopic;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    public String getAnalyticsConfigPath() {
        return analyticsConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * out-of-orderness &gt;= 0, port in [1, 65535] and non-blank topic names.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaGroupId = "pulsewatch";
        private String metricsTopic = "metric-samples";
        private String logsTopic = "log-records";
        private String sloCountsTopic = "";
        private String anomaliesTopic = "anomalies";
        private String templatesTopic = "log-templates";
        private String occurrencesTopic = "log-occurrences";
        private String sloMeasurementsTopic = "slo-measurements";
        private String sloStatusTopic = "slo-status";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 5_000;
        private String analyticsConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder metricsTopic(String v) {
            this.metricsTopic = v;
            return this;
        }

        public Builder logsTopic(String v) {
            this.logsTopic = v;
            return this;
        }

        public Builder sloCountsTopic(String v) {
            this.sloCountsTopic = v;
            return this;
        }

        public Builder anomaliesTopic(String v) {
            this.anomaliesTopic = v;
            return this;
        }

        public Builder templatesTopic(String v) {
            this.templatesTopic = v;
            return this;
        }

        public Builder occurrencesTopic(String v) {
            this.occurrencesTopic = v;
            return this;
        }

        public Builder sloMeasurementsTopic(String v) {
            this.sloMeasurementsTopic = v;
            return this;
        }

        public Builder sloStatusTopic(String v) {
            this.sloStatusTopic = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder analyticsConfigPath(String v) {
            this.analyticsConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(metricsTopic, "metricsTopic");
            requireNonBlank(logsTopic, "logsTopic");
            requireNonBlank(anomaliesTopic, "anomaliesTopic");
            requireNonBlank(templatesTopic, "templatesTopic");
            requireNonBlank(occurrencesTopic, "occurrencesTopic");
            requireNonBlank(sloMeasurementsTopic, "sloMeasurementsTopic");
            requireNonBlank(sloStatusTopic, "sloStatusTopic");
            if (sloCountsTopic == null) {
                sloCountsTopic = "";
            }
            if (analyticsConfigPath == null) {
                analyticsConfigPath = "";
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxOutOfOrdernessMs < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessMs must be >= 0, got: " + maxOutOfOrdernessMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", metricsTopic='" + metricsTopic + '\'' +
                ", logsTopic='" + logsTopic + '\'' +
                ", sloCountsTopic='" + sloCountsTopic + '\'' +
                ", anomaliesTopic='" + anomaliesTopic + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", maxOutOfOrdernessMs=" + maxOutOfOrdernessMs +
                ", analyticsConfigPath='" + analyticsConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
