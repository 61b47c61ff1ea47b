package com.pulsewatch.core.baseline;

import com.pulsewatch.core.config.BaselineSettings;
import com.pulsewatch.core.error.InsufficientDataException;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeasonalPeriod;
import com.pulsewatch.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Learns hour-of-day, day-of-week and hour-of-week behaviour of a metric.
 *
 * <h3>Algorithm</h3>
 * <p>
 * Historical samples are bucketed per granularity and reduced to per-bucket
 * mean and population standard deviation. The strength of a granularity is
 * the share of total variance explained by differences between its bucket
 * means, clipped to {@code [0, 1]}. A granularity is a pattern when its
 * strength exceeds the configured threshold and the history spans at least
 * two full periods of it. The dominant period is the first pattern in
 * hourly, daily, weekly order, replaced by a later one only when that one's
 * bucket-count-adjusted strength is higher by more than the dominance margin.
 * </p>
 *
 * <h3>Publication</h3>
 * <p>
 * {@link #recompute} publishes the new baseline into the
 * {@link BaselineRegistry}, replacing the previous one in a single reference
 * swap. {@link #lookup(String, String, Instant)} always reads a complete
 * snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalBaselineEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalBaselineEstimator.class);

    private static final List<SeasonalPeriod> GRANULARITIES =
            List.of(SeasonalPeriod.HOURLY, SeasonalPeriod.DAILY, SeasonalPeriod.WEEKLY);

    private final BaselineSettings settings;
    private final BaselineRegistry registry;
    private final SeasonalLookup lookup;

    public SeasonalBaselineEstimator(BaselineSettings settings) {
        this(settings, new BaselineRegistry());
    }

    public SeasonalBaselineEstimator(BaselineSettings settings, BaselineRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lookup = new SeasonalLookup(settings);
    }

    // ---------------------------------------------------------------
    // Recompute
    // ---------------------------------------------------------------

    /**
     * Compute a baseline from history and publish it.
     *
     * @param service service name
     * @param metric  metric name
     * @param history samples of the lookback window; samples of other series are ignored
     * @param now     compute time, start of the validity interval
     * @return the published baseline
     */
    public SeasonalBaseline recompute(String service, String metric, Collection<MetricSample> history,
            Instant now) {
        SeasonalBaseline baseline = compute(service, metric, history, now);
        long version = registry.publish(baseline);
        LOG.info("Published baseline v{} for {}|{}: samples={}, dominant={}, strengths h={} d={} w={}",
                version, service, metric, baseline.getSampleCount(), baseline.getDominantPeriod().label(),
                round(baseline.getHourlyStrength()), round(baseline.getDailyStrength()),
                round(baseline.getWeeklyStrength()));
        return baseline;
    }

    public SeasonalBaseline compute(String service, String metric, Collection<MetricSample> history,
            Instant now) {
        Objects.requireNonNull(history, "history must not be null");
        BaselineAccumulator acc = new BaselineAccumulator(settings.zone());
        for (MetricSample s : history) {
            if (s.getService().equals(service) && s.getMetricName().equals(metric)) {
                acc.add(s.getTimestamp(), s.getValue());
            }
        }
        return compute(service, metric, acc, now);
    }

    /**
     * Build a baseline from pre-accumulated moments.
     */
    public SeasonalBaseline compute(String service, String metric, BaselineAccumulator acc, Instant now) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(now, "now must not be null");

        BucketStatistics global = acc.global();
        SeasonalBaseline.Builder builder = SeasonalBaseline.builder(service, metric)
                .global(global.mean(), global.std())
                .sampleCount(global.count())
                .zoneId(acc.zone().getId())
                .validity(now, now.plus(settings.recomputeInterval()));

        for (SeasonalPeriod period : GRANULARITIES) {
            BucketStatistics[] buckets = acc.buckets(period);
            double[] means = new double[buckets.length];
            double[] stds = new double[buckets.length];
            long[] counts = new long[buckets.length];
            for (int i = 0; i < buckets.length; i++) {
                counts[i] = buckets[i].count();
                means[i] = counts[i] > 0 ? buckets[i].mean() : global.mean();
                stds[i] = counts[i] > 0 ? buckets[i].std() : global.std();
            }
            builder.buckets(period, means, stds, counts);
        }

        try {
            requireHistory(acc, SeasonalPeriod.HOURLY);
        } catch (InsufficientDataException e) {
            LOG.debug("Baseline {}|{} degraded: {}", service, metric, e.getMessage());
            for (SeasonalPeriod period : GRANULARITIES) {
                builder.pattern(period, strength(acc.buckets(period), global), false);
            }
            return builder.insufficientHistory(true).dominantPeriod(SeasonalPeriod.NONE).build();
        }

        SeasonalPeriod dominant = SeasonalPeriod.NONE;
        double dominantStrength = Double.NEGATIVE_INFINITY;
        for (SeasonalPeriod period : GRANULARITIES) {
            BucketStatistics[] buckets = acc.buckets(period);
            double strength = strength(buckets, global);
            boolean present = strength > settings.getStrengthThreshold()
                    && !acc.span().minus(requiredSpan(period)).isNegative();
            builder.pattern(period, strength, present);
            if (!present) {
                continue;
            }
            double adjusted = adjustedStrength(strength, global.count(), occupied(buckets));
            if (dominant == SeasonalPeriod.NONE || adjusted > dominantStrength + settings.getDominanceMargin()) {
                dominant = period;
                dominantStrength = adjusted;
            }
        }
        return builder.dominantPeriod(dominant).build();
    }

    /**
     * Between-bucket variance over total variance, clipped to {@code [0, 1]}.
     */
    static double strength(BucketStatistics[] buckets, BucketStatistics global) {
        double total = global.variance();
        if (global.count() == 0 || total <= 0) {
            return 0.0;
        }
        double between = 0;
        for (BucketStatistics b : buckets) {
            if (b.count() > 0) {
                double d = b.mean() - global.mean();
                between += b.count() * d * d;
            }
        }
        between /= global.count();
        return Math.max(0.0, Math.min(1.0, between / total));
    }

    /**
     * Strength corrected for the number of buckets fitted, so that hour-of-week
     * buckets, which refine hour-of-day buckets, do not win on extra degrees of
     * freedom alone.
     */
    static double adjustedStrength(double strength, long samples, int buckets) {
        if (samples <= buckets) {
            return Double.NEGATIVE_INFINITY;
        }
        return 1.0 - (1.0 - strength) * (samples - 1) / (double) (samples - buckets);
    }

    private static int occupied(BucketStatistics[] buckets) {
        int n = 0;
        for (BucketStatistics b : buckets) {
            if (b.count() > 0) {
                n++;
            }
        }
        return n;
    }

    /**
     * Two full periods, measured between the first sample of the first
     * bucket and the first sample of the last bucket of the second period.
     */
    static Duration requiredSpan(SeasonalPeriod period) {
        return Duration.ofHours(2L * period.periodHours() - period.bucketWidthHours());
    }

    private static void requireHistory(BaselineAccumulator acc, SeasonalPeriod period) {
        Duration required = requiredSpan(period);
        if (acc.span().compareTo(required) < 0) {
            throw new InsufficientDataException("history spans " + acc.span().toHours()
                    + "h, at least " + required.toHours() + "h needed for a " + period.label() + " pattern");
        }
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * Expected value at {@code timestamp} from the currently published baseline.
     *
     * @return empty when no baseline has been published for the series
     */
    public Optional<BaselineLookup> lookup(String service, String metric, Instant timestamp) {
        return registry.current(new SeriesKey(service, metric)).map(b -> lookup(b, timestamp));
    }

    /**
     * Expected value at {@code timestamp} from the given baseline.
     */
    public BaselineLookup lookup(SeasonalBaseline baseline, Instant timestamp) {
        return lookup.lookup(baseline, timestamp);
    }

    public BaselineRegistry registry() {
        return registry;
    }

    public SeasonalLookup seasonalLookup() {
        return lookup;
    }

    private static double round(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
