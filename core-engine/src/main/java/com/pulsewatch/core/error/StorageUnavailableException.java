package com.pulsewatch.core.error;

/**
 * Raised when a storage read times out or keeps failing after the configured
 * number of retries.
 *
 * @since 1.0.0
 */
public class StorageUnavailableException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public StorageUnavailableException(String message, int attempts, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
        this.attempts = attempts;
    }

    /**
     * @return number of attempts made before giving up
     */
    public int getAttempts() {
        return attempts;
    }
}
