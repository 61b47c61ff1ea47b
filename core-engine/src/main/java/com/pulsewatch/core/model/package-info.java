/**
 * Data model shared by the analytics engine and the Flink job layer.
 *
 * <p>
 * Inputs:
 * </p>
 * <ul>
 * <li>{@link com.pulsewatch.core.model.MetricSample} and
 * {@link com.pulsewatch.core.model.LogRecord} produced by ingestion</li>
 * <li>{@link com.pulsewatch.core.model.SloDefinition} loaded from
 * configuration</li>
 * </ul>
 * <p>
 * Outputs, consumed by external alerting and dashboards:
 * </p>
 * <ul>
 * <li>{@link com.pulsewatch.core.model.AnomalyEvent} (append-only)</li>
 * <li>{@link com.pulsewatch.core.model.LogTemplate} (upserted by id) and
 * {@link com.pulsewatch.core.model.LogPatternOccurrence}</li>
 * <li>{@link com.pulsewatch.core.model.SloMeasurement} (append-only) and
 * {@link com.pulsewatch.core.model.SloStatus} (upserted by SLO id)</li>
 * </ul>
 * <p>
 * {@link com.pulsewatch.core.model.SeasonalBaseline} is an immutable snapshot
 * swapped atomically per series on every recompute.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.model;
