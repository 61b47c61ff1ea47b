package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of service level indicator an SLO is measured on.
 *
 * @since 1.0.0
 */
public enum SliType {
    LATENCY("latency"),
    ERROR_RATE("error_rate"),
    AVAILABILITY("availability"),
    THROUGHPUT("throughput");

    private final String label;

    SliType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @param label configuration label, case-insensitive
     * @return the matching type
     * @throws IllegalArgumentException if the label is unknown
     */
    public static SliType fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (SliType t : values()) {
                if (t.label.equals(normalized)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sliType: '" + label
                + "'. Supported: latency, error_rate, availability, throughput");
    }
}
