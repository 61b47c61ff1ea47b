/**
 * Typed failure kinds of the analytics engine.
 *
 * <p>
 * Every exception extends {@link com.pulsewatch.core.error.AnalyticsException}
 * and reports an {@link com.pulsewatch.core.error.ErrorKind}. Failures are
 * scoped to a single key; the runtime catches them at the worker boundary.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.error;
