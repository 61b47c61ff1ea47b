package com.pulsewatch.core.logs;

import com.pulsewatch.core.baseline.BucketStatistics;
import com.pulsewatch.core.config.LogMiningSettings;

import java.io.Serializable;
import java.time.Instant;

/**
 * Occurrence-rate and inter-arrival history of one template.
 *
 * <h3>Frequency</h3>
 * <p>
 * Occurrences are counted per clock minute. Completed minutes, including
 * silent ones, go into a bounded ring of {@code rateHistoryMinutes}
 * entries. The count of the current minute is compared against the mean
 * and std of that ring for spikes. When the clock moves to a later minute,
 * the minute just finished (or 0 if silent minutes follow it) is checked
 * against the same ring for a drop.
 * </p>
 *
 * <h3>Inter-arrival</h3>
 * <p>
 * The gap to the previous occurrence is compared against the running mean
 * and std of all earlier gaps, then folded into them.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemplateActivity implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final long MINUTE_MILLIS = 60_000L;

    /** A detected deviation, in standard deviations. */
    public record Deviation(double observed, double expected, double std, double sigma, double confidence) {
    }

    private final long[] minuteCounts;
    private int ringHead;
    private int completedMinutes;
    private long currentMinute = Long.MIN_VALUE;
    private long currentCount;
    private long lastSpikeMinute = Long.MIN_VALUE;

    private final BucketStatistics gaps = new BucketStatistics();
    private long lastSeenMillis = Long.MIN_VALUE;

    public TemplateActivity(int rateHistoryMinutes) {
        if (rateHistoryMinutes < 2) {
            throw new IllegalArgumentException("rateHistoryMinutes must be >= 2, got: " + rateHistoryMinutes);
        }
        this.minuteCounts = new long[rateHistoryMinutes];
    }

    // ---------------------------------------------------------------
    // Frequency
    // ---------------------------------------------------------------

    /**
     * Count one occurrence and check the current minute against history.
     *
     * @return the spike, reported at most once per minute
     */
    public Deviation recordAndCheckRate(Instant timestamp, LogMiningSettings settings) {
        long minute = Math.floorDiv(timestamp.toEpochMilli(), MINUTE_MILLIS);
        if (currentMinute == Long.MIN_VALUE) {
            currentMinute = minute;
        } else if (minute > currentMinute) {
            roll(minute);
        }
        // late lines count towards the current minute
        currentCount++;

        if (completedMinutes < settings.getMinRateHistoryMinutes() || lastSpikeMinute == currentMinute) {
            return null;
        }
        BucketStatistics history = rateHistory();
        double std = Math.max(history.std(), settings.getMinRateStd());
        if (std <= 0) {
            return null;
        }
        double sigma = (currentCount - history.mean()) / std;
        if (sigma > settings.getSpikeSigma()) {
            lastSpikeMinute = currentMinute;
            double confidence = Math.min(1.0, (double) completedMinutes / minuteCounts.length);
            return new Deviation(currentCount, history.mean(), std, sigma, confidence);
        }
        return null;
    }

    /**
     * Move to the minute of {@code timestamp} and check the minute left behind.
     *
     * @return the drop of the finished minute, or {@code null}
     */
    public Deviation advanceAndCheckDrop(Instant timestamp, LogMiningSettings settings) {
        long minute = Math.floorDiv(timestamp.toEpochMilli(), MINUTE_MILLIS);
        if (currentMinute == Long.MIN_VALUE) {
            currentMinute = minute;
            return null;
        }
        if (minute <= currentMinute) {
            return null;
        }
        Deviation drop = null;
        if (completedMinutes >= settings.getMinRateHistoryMinutes()) {
            BucketStatistics history = rateHistory();
            double std = Math.max(history.std(), settings.getMinRateStd());
            double observed = minute - currentMinute > 1 ? 0 : currentCount;
            if (std > 0 && history.mean() >= settings.getMinDropExpected()) {
                double sigma = (observed - history.mean()) / std;
                if (sigma < -settings.getDropSigma()) {
                    double confidence = Math.min(1.0, (double) completedMinutes / minuteCounts.length);
                    drop = new Deviation(observed, history.mean(), std, sigma, confidence);
                }
            }
        }
        roll(minute);
        return drop;
    }

    private void roll(long minute) {
        push(currentCount);
        long silent = Math.min(minute - currentMinute - 1, minuteCounts.length);
        for (long i = 0; i < silent; i++) {
            push(0);
        }
        currentMinute = minute;
        currentCount = 0;
    }

    private void push(long count) {
        int capacity = minuteCounts.length;
        int tail = (ringHead + completedMinutes) % capacity;
        minuteCounts[tail] = count;
        if (completedMinutes == capacity) {
            ringHead = (ringHead + 1) % capacity;
        } else {
            completedMinutes++;
        }
    }

    BucketStatistics rateHistory() {
        BucketStatistics stats = new BucketStatistics();
        for (int i = 0; i < completedMinutes; i++) {
            stats.add(minuteCounts[(ringHead + i) % minuteCounts.length]);
        }
        return stats;
    }

    // ---------------------------------------------------------------
    // Inter-arrival
    // ---------------------------------------------------------------

    /**
     * Record the gap since the previous occurrence and check it against the
     * earlier gaps.
     *
     * @return the deviation when the gap is anomalous
     */
    public Deviation recordAndCheckGap(Instant timestamp, LogMiningSettings settings) {
        long now = timestamp.toEpochMilli();
        if (lastSeenMillis == Long.MIN_VALUE) {
            lastSeenMillis = now;
            return null;
        }
        double gapSeconds = Math.max(0, now - lastSeenMillis) / 1000.0;
        lastSeenMillis = Math.max(lastSeenMillis, now);

        Deviation result = null;
        if (gaps.count() >= settings.getMinGapSamples()) {
            double mean = gaps.mean();
            double std = Math.max(gaps.std(), settings.getMinGapStdFraction() * mean);
            if (std > 0) {
                double sigma = (gapSeconds - mean) / std;
                if (Math.abs(sigma) > settings.getTransitionSigma()) {
                    double confidence = Math.min(1.0, (double) gaps.count() / (2.0 * settings.getMinGapSamples()));
                    result = new Deviation(gapSeconds, mean, std, sigma, confidence);
                }
            }
        }
        gaps.add(gapSeconds);
        return result;
    }

    public long currentMinuteCount() {
        return currentCount;
    }

    public int completedMinutes() {
        return completedMinutes;
    }

    public long gapSamples() {
        return gaps.count();
    }
}
