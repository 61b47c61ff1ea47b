/**
 * In-process runtime: keyed single-owner workers with bounded drop-oldest
 * queues, latest-tick-wins gating, timeout and retry guard for storage reads,
 * and the {@link com.pulsewatch.core.runtime.AnalyticsEngine} facade.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.runtime;
