package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity histogram buckets of a {@link LogTemplate}.
 *
 * @since 1.0.0
 */
public enum LogSeverity {
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("fatal");

    private final String label;

    LogSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return {@code true} for {@link #ERROR} and {@link #FATAL}
     */
    public boolean isError() {
        return this == ERROR || this == FATAL;
    }

    /**
     * Map a free-form severity text onto a histogram bucket.
     *
     * <p>
     * Unknown or missing values count as {@link #INFO}.
     * </p>
     *
     * @param text severity as reported by the log producer, may be {@code null}
     * @return the bucket
     */
    public static LogSeverity parse(String text) {
        if (text == null || text.isBlank()) {
            return INFO;
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "WARN", "WARNING" -> WARN;
            case "ERROR", "ERR" -> ERROR;
            case "FATAL", "CRITICAL", "CRIT", "SEVERE", "PANIC", "EMERGENCY", "ALERT" -> FATAL;
            default -> INFO;
        };
    }
}
