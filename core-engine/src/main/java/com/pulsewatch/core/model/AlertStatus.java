package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Burn-rate alert state of an SLO.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    OK("ok"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    AlertStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
