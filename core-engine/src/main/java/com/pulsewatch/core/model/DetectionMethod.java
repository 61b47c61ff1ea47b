package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The detector that produced an {@link AnomalyEvent}.
 *
 * @since 1.0.0
 */
public enum DetectionMethod {
    ZSCORE("zscore"),
    SEASONAL("seasonal"),
    NEW_PATTERN("new_pattern"),
    FREQUENCY_SPIKE("frequency_spike"),
    FREQUENCY_DROP("frequency_drop"),
    UNEXPECTED_TRANSITION("unexpected_transition"),
    PATTERN_TRANSITION("pattern_transition");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
