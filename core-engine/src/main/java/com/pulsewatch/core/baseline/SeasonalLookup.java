package com.pulsewatch.core.baseline;

import com.pulsewatch.core.config.BaselineSettings;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeasonalPeriod;

import java.io.Serializable;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Reads the expected value of a series at an instant from a baseline
 * snapshot.
 *
 * <p>
 * The dominant granularity's bucket is used when it holds at least
 * {@code minBucketSamples} samples; otherwise global statistics are used and
 * confidence is capped at {@code 1 - lowConfidencePenalty}. A baseline
 * computed from insufficient history always yields confidence {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalLookup implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Absolute lower bound of an expected standard deviation. */
    static final double MIN_STD = 1e-10;

    /** Expected std is never below this fraction of the global std. */
    static final double GLOBAL_STD_FLOOR = 0.1;

    private final int minBucketSamples;
    private final int fullConfidenceSamples;
    private final double lowConfidencePenalty;

    public SeasonalLookup(BaselineSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.minBucketSamples = settings.getMinBucketSamples();
        this.fullConfidenceSamples = settings.getFullConfidenceSamples();
        this.lowConfidencePenalty = settings.getLowConfidencePenalty();
    }

    public BaselineLookup lookup(SeasonalBaseline baseline, Instant timestamp) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");

        long total = baseline.getSampleCount();
        double globalConfidence = Math.min(1.0, (double) total / fullConfidenceSamples);
        double globalStd = floorStd(baseline.getGlobalStd(), baseline);

        if (baseline.isInsufficientHistory()) {
            return new BaselineLookup(baseline.getGlobalMean(), globalStd, 0.0,
                    SeasonalPeriod.NONE, -1, total, true);
        }
        SeasonalPeriod period = baseline.getDominantPeriod();
        if (period == SeasonalPeriod.NONE) {
            return new BaselineLookup(baseline.getGlobalMean(), globalStd, globalConfidence,
                    SeasonalPeriod.NONE, -1, total, false);
        }

        int bucket = SeasonalBuckets.bucket(period, timestamp, ZoneId.of(baseline.getZoneId()));
        long n = baseline.count(period, bucket);
        if (n < minBucketSamples) {
            double capped = Math.min(globalConfidence, 1.0 - lowConfidencePenalty);
            return new BaselineLookup(baseline.getGlobalMean(), globalStd, capped,
                    period, bucket, n, true);
        }
        double confidence = Math.min(1.0, (double) n / fullConfidenceSamples);
        return new BaselineLookup(baseline.mean(period, bucket),
                floorStd(baseline.std(period, bucket), baseline), confidence, period, bucket, n, false);
    }

    private static double floorStd(double std, SeasonalBaseline baseline) {
        return Math.max(std, Math.max(baseline.getGlobalStd() * GLOBAL_STD_FLOOR, MIN_STD));
    }
}
