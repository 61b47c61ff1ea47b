package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucketing granularities learned by the seasonal baseline.
 *
 * <p>
 * Declared from finest to coarsest; the declaration order is the tie-break
 * order when two granularities report the same strength.
 * </p>
 *
 * @since 1.0.0
 */
public enum SeasonalPeriod {

    /** Hour of day, 24 buckets, period of one day. */
    HOURLY("hourly", 24, 1, 24),

    /** Day of week, 7 buckets, period of one week. */
    DAILY("daily", 7, 24, 168),

    /** Hour of week, 168 buckets, period of one week. */
    WEEKLY("weekly", 168, 1, 168),

    /** No pattern present. */
    NONE("none", 0, 0, 0);

    private final String label;
    private final int buckets;
    private final int bucketWidthHours;
    private final int periodHours;

    SeasonalPeriod(String label, int buckets, int bucketWidthHours, int periodHours) {
        this.label = label;
        this.buckets = buckets;
        this.bucketWidthHours = bucketWidthHours;
        this.periodHours = periodHours;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int buckets() {
        return buckets;
    }

    public int bucketWidthHours() {
        return bucketWidthHours;
    }

    public int periodHours() {
        return periodHours;
    }
}
