/**
 * Drain-style log template mining and pattern anomaly detection.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.logs;
