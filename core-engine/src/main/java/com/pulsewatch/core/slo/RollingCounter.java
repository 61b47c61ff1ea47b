package com.pulsewatch.core.slo;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;

/**
 * Good/bad event counts in fixed-width time buckets over a bounded horizon.
 *
 * <p>
 * Slots are reused round-robin; a slot whose bucket number is older than
 * the horizon is reset before reuse, so stale counts never leak into a sum.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingCounter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long bucketMillis;
    private final long[] bucketIds;
    private final long[] good;
    private final long[] bad;

    /**
     * @param bucketMillis width of one bucket
     * @param buckets      number of buckets retained
     */
    public RollingCounter(long bucketMillis, int buckets) {
        if (bucketMillis < 1 || buckets < 1) {
            throw new IllegalArgumentException("bucketMillis and buckets must be >= 1");
        }
        this.bucketMillis = bucketMillis;
        this.bucketIds = new long[buckets];
        this.good = new long[buckets];
        this.bad = new long[buckets];
        Arrays.fill(bucketIds, Long.MIN_VALUE);
    }

    private RollingCounter(RollingCounter other) {
        this.bucketMillis = other.bucketMillis;
        this.bucketIds = other.bucketIds.clone();
        this.good = other.good.clone();
        this.bad = other.bad.clone();
    }

    /**
     * @return an independent copy of this counter
     */
    public RollingCounter copy() {
        return new RollingCounter(this);
    }

    public void add(Instant timestamp, long goodCount, long badCount) {
        long id = Math.floorDiv(timestamp.toEpochMilli(), bucketMillis);
        int slot = (int) Math.floorMod(id, (long) bucketIds.length);
        if (bucketIds[slot] != id) {
            if (bucketIds[slot] > id) {
                // older than the horizon already covered by this slot
                return;
            }
            bucketIds[slot] = id;
            good[slot] = 0;
            bad[slot] = 0;
        }
        good[slot] += goodCount;
        bad[slot] += badCount;
    }

    /**
     * Sum of the {@code buckets} most recent buckets ending with the bucket
     * containing {@code now}.
     *
     * @return {@code [good, bad]}
     */
    public long[] sum(Instant now, int buckets) {
        int span = Math.min(buckets, bucketIds.length);
        long newest = Math.floorDiv(now.toEpochMilli(), bucketMillis);
        long oldest = newest - span + 1;
        long g = 0;
        long b = 0;
        for (int i = 0; i < bucketIds.length; i++) {
            long id = bucketIds[i];
            if (id >= oldest && id <= newest) {
                g += good[i];
                b += bad[i];
            }
        }
        return new long[] {g, b};
    }

    public int buckets() {
        return bucketIds.length;
    }
}
