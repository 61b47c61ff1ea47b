/**
 * Apache Flink streaming job for PulseWatch.
 *
 * <p>
 * This package runs the analytics core inside a Flink pipeline: metric
 * samples, log records and SLO counts are consumed from Kafka, processed per
 * key with all per-key state in Flink keyed state, and every output stream is
 * published back to Kafka as JSON.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.pulsewatch.flink.PulseWatchJob}: main entry point</li>
 * <li>{@link com.pulsewatch.flink.MetricAnomalyProcessFunction}: scoring and
 * baseline upkeep per series</li>
 * <li>{@link com.pulsewatch.flink.LogMiningProcessFunction}: template mining
 * per service</li>
 * <li>{@link com.pulsewatch.flink.SloEvaluationProcessFunction}: SLO ticks</li>
 * <li>{@link com.pulsewatch.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.pulsewatch.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pulsewatch.flink;
