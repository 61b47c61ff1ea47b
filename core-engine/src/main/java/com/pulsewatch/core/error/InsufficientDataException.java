package com.pulsewatch.core.error;

/**
 * Raised when a computation lacks the history it needs.
 *
 * <p>
 * Callers translate this into a low-confidence result; it is never surfaced
 * as a failed tick.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }
}
