package com.pulsewatch.core.baseline;

import java.io.Serializable;

/**
 * Online mean/variance accumulator (Welford), mergeable with another
 * accumulator (Chan et al. parallel update).
 *
 * <p>
 * Variance is the population variance, matching the two-pass
 * {@link #twoPass(double[])} computation up to floating-point tolerance.
 * </p>
 *
 * @since 1.0.0
 */
public final class BucketStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private long count;
    private double mean;
    private double m2;

    public BucketStatistics() {
    }

    private BucketStatistics(long count, double mean, double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    /**
     * Fold another accumulator into this one.
     *
     * @param other accumulator over a disjoint set of values
     */
    public void merge(BucketStatistics other) {
        if (other.count == 0) {
            return;
        }
        if (count == 0) {
            count = other.count;
            mean = other.mean;
            m2 = other.m2;
            return;
        }
        long total = count + other.count;
        double delta = other.mean - mean;
        mean += delta * other.count / total;
        m2 += other.m2 + delta * delta * ((double) count * other.count / total);
        count = total;
    }

    public long count() {
        return count;
    }

    public double mean() {
        return mean;
    }

    public double variance() {
        return count == 0 ? 0.0 : Math.max(0.0, m2 / count);
    }

    public double std() {
        return Math.sqrt(variance());
    }

    public BucketStatistics copy() {
        return new BucketStatistics(count, mean, m2);
    }

    /**
     * Batch two-pass computation over a complete set of values.
     *
     * @param values the values
     * @return an accumulator holding the same moments
     */
    public static BucketStatistics twoPass(double[] values) {
        if (values.length == 0) {
            return new BucketStatistics();
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / values.length;
        double squared = 0;
        for (double v : values) {
            double d = v - mean;
            squared += d * d;
        }
        return new BucketStatistics(values.length, mean, squared);
    }

    @Override
    public String toString() {
        return "BucketStatistics{n=" + count + ", mean=" + mean + ", std=" + std() + '}';
    }
}
