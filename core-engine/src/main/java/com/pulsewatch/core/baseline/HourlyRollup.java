package com.pulsewatch.core.baseline;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Moments of one series over one clock hour.
 *
 * <p>
 * Every sample of an hour lands in the same bucket of every granularity, so
 * merging rollups reproduces the per-bucket statistics of the raw samples
 * exactly. Streaming deployments keep a bounded list of rollups instead of
 * raw history.
 * </p>
 *
 * @since 1.0.0
 */
public final class HourlyRollup implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant hourStart;
    private final BucketStatistics statistics = new BucketStatistics();
    private Instant first;
    private Instant last;

    public HourlyRollup(Instant hourStart) {
        this.hourStart = Objects.requireNonNull(hourStart, "hourStart must not be null")
                .truncatedTo(ChronoUnit.HOURS);
    }

    public static Instant hourOf(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * @throws IllegalArgumentException if the timestamp is outside this hour
     */
    public void add(Instant timestamp, double value) {
        if (!hourOf(timestamp).equals(hourStart)) {
            throw new IllegalArgumentException("Timestamp " + timestamp + " is outside hour " + hourStart);
        }
        statistics.add(value);
        if (first == null || timestamp.isBefore(first)) {
            first = timestamp;
        }
        if (last == null || timestamp.isAfter(last)) {
            last = timestamp;
        }
    }

    public boolean covers(Instant timestamp) {
        return hourOf(timestamp).equals(hourStart);
    }

    /**
     * @return {@code true} if the whole hour lies before {@code cutoff}
     */
    public boolean isOlderThan(Instant cutoff) {
        return !hourStart.plus(Duration.ofHours(1)).isAfter(cutoff);
    }

    public Instant getHourStart() {
        return hourStart;
    }

    public BucketStatistics getStatistics() {
        return statistics;
    }

    public Instant getFirst() {
        return first;
    }

    public Instant getLast() {
        return last;
    }
}
