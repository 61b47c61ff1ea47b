package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity attached to an {@link AnomalyEvent}.
 *
 * @since 1.0.0
 */
public enum Severity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Classify an absolute deviation against the warning and critical cutoffs.
     *
     * @param absSigma         absolute deviation in standard deviations
     * @param warningSigma     deviation strictly above which a warning is raised
     * @param criticalSigma    deviation strictly above which the event is critical
     * @return the severity, or {@code null} when the deviation is within range
     */
    public static Severity fromSigma(double absSigma, double warningSigma, double criticalSigma) {
        if (absSigma > criticalSigma) {
            return CRITICAL;
        }
        if (absSigma > warningSigma) {
            return WARNING;
        }
        return null;
    }
}
