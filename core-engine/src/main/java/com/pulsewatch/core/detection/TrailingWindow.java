package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.BucketStatistics;

import java.io.Serializable;
import java.time.Instant;

/**
 * Bounded ring buffer of recent {@code (timestamp, value)} observations of one
 * series.
 *
 * <p>
 * When full, appending evicts the oldest observation.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrailingWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long[] timestamps;
    private final double[] values;
    private int head;
    private int size;

    /**
     * @param capacity maximum number of retained observations, at least 2
     */
    public TrailingWindow(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be >= 2, got: " + capacity);
        }
        this.timestamps = new long[capacity];
        this.values = new double[capacity];
    }

    /**
     * Append an observation, evicting the oldest one when full.
     *
     * @return {@code true} if an observation was evicted
     */
    public boolean append(Instant timestamp, double value) {
        int capacity = timestamps.length;
        int tail = (head + size) % capacity;
        timestamps[tail] = timestamp.toEpochMilli();
        values[tail] = value;
        if (size == capacity) {
            head = (head + 1) % capacity;
            return true;
        }
        size++;
        return false;
    }

    /**
     * Moments of the observations with {@code from <= timestamp < to}.
     */
    public BucketStatistics statistics(Instant from, Instant to) {
        long lo = from.toEpochMilli();
        long hi = to.toEpochMilli();
        BucketStatistics stats = new BucketStatistics();
        for (int i = 0; i < size; i++) {
            int idx = (head + i) % timestamps.length;
            long ts = timestamps[idx];
            if (ts >= lo && ts < hi) {
                stats.add(values[idx]);
            }
        }
        return stats;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return timestamps.length;
    }
}
