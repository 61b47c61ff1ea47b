package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison deciding whether a single SLI sample counts as good.
 *
 * <p>
 * A sample is good when {@code value <operator> threshold} holds, e.g.
 * {@code latency lt 300}.
 * </p>
 *
 * @since 1.0.0
 */
public enum SliOperator {
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte");

    private final String label;

    SliOperator(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isGood(double value, double threshold) {
        return switch (this) {
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case GT -> value > threshold;
            case GTE -> value >= threshold;
        };
    }

    /**
     * @param label configuration label, case-insensitive
     * @return the matching operator
     * @throws IllegalArgumentException if the label is unknown
     */
    public static SliOperator fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (SliOperator op : values()) {
                if (op.label.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + label
                + "'. Supported: lt, lte, gt, gte");
    }
}
