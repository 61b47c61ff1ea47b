package com.pulsewatch.core.error;

import java.util.Objects;

/**
 * Base type of every failure raised by the analytics engine.
 *
 * @since 1.0.0
 */
public abstract class AnalyticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected AnalyticsException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected AnalyticsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * @return the error classification
     */
    public ErrorKind getKind() {
        return kind;
    }
}
