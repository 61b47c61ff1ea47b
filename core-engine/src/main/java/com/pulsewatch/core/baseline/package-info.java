/**
 * Seasonal baseline estimation.
 *
 * <p>
 * {@link com.pulsewatch.core.baseline.SeasonalBaselineEstimator} learns
 * per-bucket statistics from history and publishes immutable snapshots into
 * {@link com.pulsewatch.core.baseline.BaselineRegistry};
 * {@link com.pulsewatch.core.baseline.HourlyRollup} lets streaming
 * deployments keep bounded history.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.baseline;
