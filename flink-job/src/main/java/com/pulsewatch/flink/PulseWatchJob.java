package com.pulsewatch.flink;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.config.AnalyticsConfigLoader;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SloStatus;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the PulseWatch Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (metric samples)
 *     → key by service|metric → MetricAnomalyProcessFunction → anomalies
 *     → SloSampleRouter ─┐
 *   Kafka (SLO counts, optional) ─┴→ key by sloId → SloEvaluationProcessFunction
 *                                      → SLO status, SLO measurements
 *   Kafka (log records)
 *     → key by service → LogMiningProcessFunction
 *                          → anomalies, templates, occurrences
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * analytics settings from the YAML file loaded by {@link AnalyticsConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps trailing windows, hourly rollups, template
 * sets and SLO counters consistent across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class PulseWatchJob {

        private static final Logger LOG = LoggerFactory.getLogger(PulseWatchJob.class);

        private PulseWatchJob() {
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting PulseWatch with config: {}", config);
                AnalyticsConfig analytics = loadAnalytics(config);
                LOG.info("Loaded analytics configuration: {}", analytics);

                // 2. Health server, ready once the pipeline is assembled
                AtomicBoolean ready = new AtomicBoolean(false);
                HealthServer healthServer = new HealthServer(ready::get);
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 3. Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Pipeline
                buildPipeline(env, config, analytics);
                ready.set(true);

                // 5. Execute
                env.execute("PulseWatch – Telemetry Analytics");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, AnalyticsConfig analytics) {
                Duration outOfOrderness = Duration.ofMillis(config.getMaxOutOfOrdernessMs());

                // Metric samples
                DataStream<MetricSample> samples = env.fromSource(
                                source(config, config.getMetricsTopic(), MetricSample.class),
                                WatermarkStrategy.<MetricSample>forBoundedOutOfOrderness(outOfOrderness)
                                                .withTimestampAssigner((s, ts) -> s.getTimestamp().toEpochMilli())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-metrics-source")
                                .filter(Objects::nonNull)
                                .name("drop-malformed-samples");

                DataStream<AnomalyEvent> metricAnomalies = samples
                                .keyBy(s -> s.seriesKey().toString())
                                .process(new MetricAnomalyProcessFunction(analytics))
                                .name("metric-anomaly-detection");

                // Log records
                DataStream<LogRecord> logs = env.fromSource(
                                source(config, config.getLogsTopic(), LogRecord.class),
                                WatermarkStrategy.<LogRecord>forBoundedOutOfOrderness(outOfOrderness)
                                                .withTimestampAssigner((r, ts) -> r.getTimestamp().toEpochMilli())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-logs-source")
                                .filter(Objects::nonNull)
                                .name("drop-malformed-logs");

                SingleOutputStreamOperator<AnomalyEvent> logAnomalies = logs
                                .keyBy(LogRecord::getService)
                                .process(new LogMiningProcessFunction(analytics.getLogMining()))
                                .name("log-template-mining");

                // SLO counts: classified samples, plus pre-aggregated counts when configured
                DataStream<SloCountTick> counts = samples
                                .flatMap(new SloSampleRouter(analytics))
                                .name("sli-classification");
                if (config.hasSloCountsTopic()) {
                        counts = counts.union(env.fromSource(
                                        source(config, config.getSloCountsTopic(), SloCountTick.class),
                                        WatermarkStrategy.<SloCountTick>forBoundedOutOfOrderness(outOfOrderness)
                                                        .withTimestampAssigner((c, ts) -> c.getTimestamp().toEpochMilli())
                                                        .withIdleness(Duration.ofMinutes(1)),
                                        "kafka-slo-counts-source")
                                        .filter(Objects::nonNull)
                                        .name("drop-malformed-counts"));
                }

                SingleOutputStreamOperator<SloStatus> statuses = counts
                                .keyBy(SloCountTick::getSloId)
                                .process(new SloEvaluationProcessFunction(analytics))
                                .name("slo-evaluation");

                // Sinks
                metricAnomalies.union(logAnomalies)
                                .sinkTo(jsonSink(config, config.getAnomaliesTopic()))
                                .name("kafka-anomalies-sink");
                logAnomalies.getSideOutput(LogMiningProcessFunction.TEMPLATES)
                                .sinkTo(jsonSink(config, config.getTemplatesTopic()))
                                .name("kafka-templates-sink");
                logAnomalies.getSideOutput(LogMiningProcessFunction.OCCURRENCES)
                                .sinkTo(jsonSink(config, config.getOccurrencesTopic()))
                                .name("kafka-occurrences-sink");
                statuses.sinkTo(jsonSink(config, config.getSloStatusTopic()))
                                .name("kafka-slo-status-sink");
                statuses.getSideOutput(SloEvaluationProcessFunction.MEASUREMENTS)
                                .sinkTo(jsonSink(config, config.getSloMeasurementsTopic()))
                                .name("kafka-slo-measurements-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSource<T> source(JobConfig config, String topic, Class<T> type) {
                return KafkaSource.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(topic)
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new JsonDeserializationSchema<>(type))
                                .build();
        }

        private static <T> KafkaSink<T> jsonSink(JobConfig config, String topic) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(
                                                                                new JsonSerializationSchema<T>())
                                                                .build())
                                .build();
        }

        static AnalyticsConfig loadAnalytics(JobConfig config) {
                String path = config.getAnalyticsConfigPath();
                if (path != null && !path.isBlank()) {
                        return AnalyticsConfigLoader.fromFile(path);
                }
                return AnalyticsConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
