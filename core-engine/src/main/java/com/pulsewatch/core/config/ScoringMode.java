package com.pulsewatch.core.config;

import java.util.Locale;

/**
 * Metric scoring mode, selectable per metric.
 *
 * @since 1.0.0
 */
public enum ScoringMode {
    /** Rolling z-score over a short trailing window only. */
    ZSCORE,
    /** Seasonal-baseline deviation only. */
    SEASONAL,
    /** Both; seasonal wins a tie when it is at least as confident. */
    COMBINED;

    /**
     * @param text mode name, case-insensitive
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ScoringMode parse(String text) {
        if (text != null) {
            String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (ScoringMode m : values()) {
                if (m.name().equals(normalized)) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("Unknown scoring mode: '" + text
                + "'. Supported: zscore, seasonal, combined");
    }
}
