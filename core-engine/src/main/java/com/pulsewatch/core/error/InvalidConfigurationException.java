package com.pulsewatch.core.error;

/**
 * Raised when an SLO definition, a metric policy or a global setting is
 * malformed.
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
    }
}
