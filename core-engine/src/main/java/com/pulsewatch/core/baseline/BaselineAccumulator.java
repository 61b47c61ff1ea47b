package com.pulsewatch.core.baseline;

import com.pulsewatch.core.model.SeasonalPeriod;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Per-bucket Welford accumulators for all three granularities plus the
 * global moments of one series.
 *
 * @since 1.0.0
 */
public final class BaselineAccumulator {

    private final ZoneId zone;
    private final BucketStatistics global = new BucketStatistics();
    private final BucketStatistics[] hourly = fresh(SeasonalPeriod.HOURLY);
    private final BucketStatistics[] daily = fresh(SeasonalPeriod.DAILY);
    private final BucketStatistics[] weekly = fresh(SeasonalPeriod.WEEKLY);
    private Instant first;
    private Instant last;

    public BaselineAccumulator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    private static BucketStatistics[] fresh(SeasonalPeriod period) {
        BucketStatistics[] stats = new BucketStatistics[period.buckets()];
        for (int i = 0; i < stats.length; i++) {
            stats[i] = new BucketStatistics();
        }
        return stats;
    }

    /**
     * Add one raw sample. Non-finite values are ignored.
     */
    public void add(Instant timestamp, double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        global.add(value);
        hourly[SeasonalBuckets.bucket(SeasonalPeriod.HOURLY, timestamp, zone)].add(value);
        daily[SeasonalBuckets.bucket(SeasonalPeriod.DAILY, timestamp, zone)].add(value);
        weekly[SeasonalBuckets.bucket(SeasonalPeriod.WEEKLY, timestamp, zone)].add(value);
        extend(timestamp, timestamp);
    }

    /**
     * Add the pre-aggregated moments of one clock hour.
     */
    public void add(HourlyRollup rollup) {
        BucketStatistics stats = rollup.getStatistics();
        if (stats.count() == 0) {
            return;
        }
        Instant hour = rollup.getHourStart();
        global.merge(stats);
        hourly[SeasonalBuckets.bucket(SeasonalPeriod.HOURLY, hour, zone)].merge(stats);
        daily[SeasonalBuckets.bucket(SeasonalPeriod.DAILY, hour, zone)].merge(stats);
        weekly[SeasonalBuckets.bucket(SeasonalPeriod.WEEKLY, hour, zone)].merge(stats);
        extend(rollup.getFirst(), rollup.getLast());
    }

    private void extend(Instant from, Instant to) {
        if (first == null || from.isBefore(first)) {
            first = from;
        }
        if (last == null || to.isAfter(last)) {
            last = to;
        }
    }

    public BucketStatistics global() {
        return global;
    }

    public BucketStatistics[] buckets(SeasonalPeriod period) {
        return switch (period) {
            case HOURLY -> hourly;
            case DAILY -> daily;
            case WEEKLY -> weekly;
            case NONE -> throw new IllegalArgumentException("NONE has no buckets");
        };
    }

    /**
     * @return time between the first and the last sample, zero when empty
     */
    public Duration span() {
        return first == null ? Duration.ZERO : Duration.between(first, last);
    }

    public long count() {
        return global.count();
    }

    public ZoneId zone() {
        return zone;
    }
}
