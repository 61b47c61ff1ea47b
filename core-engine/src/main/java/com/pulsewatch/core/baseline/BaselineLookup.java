package com.pulsewatch.core.baseline;

import com.pulsewatch.core.model.SeasonalPeriod;

import java.util.Locale;

/**
 * Expected value and spread of a series at one instant.
 *
 * @param expected       expected value
 * @param expectedStd    expected standard deviation, floored above zero
 * @param confidence     confidence in {@code [0, 1]}
 * @param period         granularity used, {@link SeasonalPeriod#NONE} for global statistics
 * @param bucket         bucket index within {@code period}, {@code -1} for global statistics
 * @param bucketSamples  samples behind the statistics used
 * @param globalFallback {@code true} when the seasonal bucket was too thin and
 *                       global statistics were used instead
 * @since 1.0.0
 */
public record BaselineLookup(double expected, double expectedStd, double confidence,
        SeasonalPeriod period, int bucket, long bucketSamples, boolean globalFallback) {

    /**
     * @return a human-readable context, e.g. {@code "Unusual for hour 14:00 (expected ~120.00)"}
     */
    public String describe() {
        if (period == SeasonalPeriod.NONE || bucket < 0) {
            return String.format(Locale.ROOT, "Unusual compared to overall baseline (expected ~%.2f)", expected);
        }
        return String.format(Locale.ROOT, "Unusual for %s (expected ~%.2f)",
                SeasonalBuckets.describe(period, bucket), expected);
    }
}
