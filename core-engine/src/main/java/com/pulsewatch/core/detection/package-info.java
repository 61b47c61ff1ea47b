/**
 * Metric anomaly detection.
 *
 * <p>
 * Two interchangeable {@link com.pulsewatch.core.detection.MetricScorer}
 * implementations, a rolling z-score and a seasonal-baseline deviation, are
 * combined per series by
 * {@link com.pulsewatch.core.detection.SeriesAnomalyScorer}.
 * {@link com.pulsewatch.core.detection.AnomalyDetector} is the entry point
 * used by the engine.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.detection;
