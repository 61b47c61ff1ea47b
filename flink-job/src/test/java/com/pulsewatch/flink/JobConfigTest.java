package com.pulsewatch.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults for unset variables")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.from(Map.of());

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getMetricsTopic()).isEqualTo("metric-samples");
        assertThat(config.getAnomaliesTopic()).isEqualTo("anomalies");
        assertThat(config.hasSloCountsTopic()).isFalse();
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getAnalyticsConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should read overrides from the environment map")
    void shouldReadOverrides() {
        JobConfig config = JobConfig.from(Map.of(
                "KAFKA_SLO_COUNTS_TOPIC", "slo-counts",
                "FLINK_PARALLELISM", "4",
                "ANALYTICS_CONFIG_PATH", "/etc/pulsewatch/analytics.yml",
                "KAFKA_LOGS_TOPIC", "  "));

        assertThat(config.hasSloCountsTopic()).isTrue();
        assertThat(config.getSloCountsTopic()).isEqualTo("slo-counts");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getAnalyticsConfigPath()).isEqualTo("/etc/pulsewatch/analytics.yml");
        // blank values count as unset
        assertThat(config.getLogsTopic()).isEqualTo("log-records");
    }

    @Test
    @DisplayName("Should reject unparsable numbers")
    void shouldRejectBadNumbers() {
        assertThatThrownBy(() -> JobConfig.from(Map.of("HEALTH_PORT", "http")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    @DisplayName("Should validate ranges and topic names in the builder")
    void shouldValidateInBuilder() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new JobConfig.Builder().sloStatusTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sloStatusTopic");
        assertThat(new JobConfig.Builder().sloCountsTopic(null).build().hasSloCountsTopic()).isFalse();
    }
}
