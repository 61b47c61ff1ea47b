/**
 * YAML configuration of the analytics engine.
 *
 * <p>
 * {@link com.pulsewatch.core.config.AnalyticsConfigLoader} parses the YAML
 * with SnakeYAML into {@link com.pulsewatch.core.config.AnalyticsConfig} and
 * validates it. Thresholds and caps are tunable settings, never constants of
 * the algorithms.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.config;
