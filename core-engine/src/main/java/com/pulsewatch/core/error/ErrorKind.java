package com.pulsewatch.core.error;

/**
 * Classification of the failures the analytics engine can encounter.
 *
 * <p>
 * None of these kinds is fatal to the process. Each one is local to the key
 * (series, service or SLO) whose processing raised it.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Too few samples or buckets. Degrades confidence, never fails a call. */
    INSUFFICIENT_DATA,

    /** A storage read timed out or failed after bounded retries. */
    STORAGE_UNAVAILABLE,

    /** A malformed SLO definition or threshold, rejected at load time. */
    INVALID_CONFIGURATION,

    /** A template or queue cap was hit; handled by eviction or drop policies. */
    CAPACITY_EXCEEDED
}
