package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Learned periodic statistics of one (service, metric) series.
 *
 * <p>
 * Immutable snapshot. A recompute builds a complete new instance that
 * replaces the previous one wholesale; nothing is ever mutated in place, so
 * readers holding a reference always see a consistent set of buckets.
 * </p>
 *
 * <p>
 * Per-bucket arrays are indexed as follows: hour of day {@code 0..23}, day of
 * week {@code 0..6} (Monday = 0), hour of week {@code 0..167}
 * ({@code day * 24 + hour}).
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String service;
    private final String metricName;

    private final double[] hourlyMeans;
    private final double[] hourlyStds;
    private final long[] hourlyCounts;
    private final double[] dailyMeans;
    private final double[] dailyStds;
    private final long[] dailyCounts;
    private final double[] weeklyMeans;
    private final double[] weeklyStds;
    private final long[] weeklyCounts;

    private final double globalMean;
    private final double globalStd;

    private final double hourlyStrength;
    private final double dailyStrength;
    private final double weeklyStrength;
    private final boolean hasHourlyPattern;
    private final boolean hasDailyPattern;
    private final boolean hasWeeklyPattern;
    private final SeasonalPeriod dominantPeriod;

    /** {@code true} when the history spanned fewer than two periods. */
    private final boolean insufficientHistory;

    private final Instant validFrom;
    private final Instant validTo;
    private final long sampleCount;
    private final String zoneId;

    private SeasonalBaseline(Builder b) {
        this.service = Objects.requireNonNull(b.service, "service must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.hourlyMeans = sized(b.hourlyMeans, 24, "hourlyMeans");
        this.hourlyStds = sized(b.hourlyStds, 24, "hourlyStds");
        this.hourlyCounts = sized(b.hourlyCounts, 24, "hourlyCounts");
        this.dailyMeans = sized(b.dailyMeans, 7, "dailyMeans");
        this.dailyStds = sized(b.dailyStds, 7, "dailyStds");
        this.dailyCounts = sized(b.dailyCounts, 7, "dailyCounts");
        this.weeklyMeans = sized(b.weeklyMeans, 168, "weeklyMeans");
        this.weeklyStds = sized(b.weeklyStds, 168, "weeklyStds");
        this.weeklyCounts = sized(b.weeklyCounts, 168, "weeklyCounts");
        this.globalMean = b.globalMean;
        this.globalStd = b.globalStd;
        this.hourlyStrength = b.hourlyStrength;
        this.dailyStrength = b.dailyStrength;
        this.weeklyStrength = b.weeklyStrength;
        this.hasHourlyPattern = b.hasHourlyPattern;
        this.hasDailyPattern = b.hasDailyPattern;
        this.hasWeeklyPattern = b.hasWeeklyPattern;
        this.dominantPeriod = b.dominantPeriod != null ? b.dominantPeriod : SeasonalPeriod.NONE;
        this.insufficientHistory = b.insufficientHistory;
        this.validFrom = Objects.requireNonNull(b.validFrom, "validFrom must not be null");
        this.validTo = Objects.requireNonNull(b.validTo, "validTo must not be null");
        this.sampleCount = b.sampleCount;
        this.zoneId = b.zoneId != null ? b.zoneId : "UTC";
    }

    private static double[] sized(double[] values, int size, String name) {
        if (values == null) {
            return new double[size];
        }
        if (values.length != size) {
            throw new IllegalArgumentException(name + " must have " + size + " entries, got: " + values.length);
        }
        return values.clone();
    }

    private static long[] sized(long[] values, int size, String name) {
        if (values == null) {
            return new long[size];
        }
        if (values.length != size) {
            throw new IllegalArgumentException(name + " must have " + size + " entries, got: " + values.length);
        }
        return values.clone();
    }

    // ---------------------------------------------------------------
    // Bucket access by granularity
    // ---------------------------------------------------------------

    public double mean(SeasonalPeriod period, int bucket) {
        return switch (period) {
            case HOURLY -> hourlyMeans[bucket];
            case DAILY -> dailyMeans[bucket];
            case WEEKLY -> weeklyMeans[bucket];
            case NONE -> globalMean;
        };
    }

    public double std(SeasonalPeriod period, int bucket) {
        return switch (period) {
            case HOURLY -> hourlyStds[bucket];
            case DAILY -> dailyStds[bucket];
            case WEEKLY -> weeklyStds[bucket];
            case NONE -> globalStd;
        };
    }

    public long count(SeasonalPeriod period, int bucket) {
        return switch (period) {
            case HOURLY -> hourlyCounts[bucket];
            case DAILY -> dailyCounts[bucket];
            case WEEKLY -> weeklyCounts[bucket];
            case NONE -> sampleCount;
        };
    }

    public double strength(SeasonalPeriod period) {
        return switch (period) {
            case HOURLY -> hourlyStrength;
            case DAILY -> dailyStrength;
            case WEEKLY -> weeklyStrength;
            case NONE -> 0.0;
        };
    }

    public boolean hasPattern(SeasonalPeriod period) {
        return switch (period) {
            case HOURLY -> hasHourlyPattern;
            case DAILY -> hasDailyPattern;
            case WEEKLY -> hasWeeklyPattern;
            case NONE -> false;
        };
    }

    /**
     * @param at an instant
     * @return {@code true} if {@code at} falls within {@code [validFrom, validTo)}
     */
    public boolean isValidAt(Instant at) {
        return !at.isBefore(validFrom) && at.isBefore(validTo);
    }

    // ---------------------------------------------------------------
    // Getters (arrays are copies)
    // ---------------------------------------------------------------

    public String getService() {
        return service;
    }

    public String getMetricName() {
        return metricName;
    }

    public double[] getHourlyMeans() {
        return hourlyMeans.clone();
    }

    public double[] getHourlyStds() {
        return hourlyStds.clone();
    }

    public double[] getDailyMeans() {
        return dailyMeans.clone();
    }

    public double[] getDailyStds() {
        return dailyStds.clone();
    }

    public double[] getWeeklyMeans() {
        return weeklyMeans.clone();
    }

    public double[] getWeeklyStds() {
        return weeklyStds.clone();
    }

    public double getGlobalMean() {
        return globalMean;
    }

    public double getGlobalStd() {
        return globalStd;
    }

    public boolean isHasHourlyPattern() {
        return hasHourlyPattern;
    }

    public boolean isHasDailyPattern() {
        return hasDailyPattern;
    }

    public boolean isHasWeeklyPattern() {
        return hasWeeklyPattern;
    }

    public double getHourlyStrength() {
        return hourlyStrength;
    }

    public double getDailyStrength() {
        return dailyStrength;
    }

    public double getWeeklyStrength() {
        return weeklyStrength;
    }

    public SeasonalPeriod getDominantPeriod() {
        return dominantPeriod;
    }

    public boolean isInsufficientHistory() {
        return insufficientHistory;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    public Instant getValidTo() {
        return validTo;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public String getZoneId() {
        return zoneId;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder(String service, String metricName) {
        return new Builder(service, metricName);
    }

    /**
     * Fluent builder for {@link SeasonalBaseline}. Arrays are copied at
     * {@link #build()} time.
     */
    public static class Builder {
        private final String service;
        private final String metricName;
        private double[] hourlyMeans;
        private double[] hourlyStds;
        private long[] hourlyCounts;
        private double[] dailyMeans;
        private double[] dailyStds;
        private long[] dailyCounts;
        private double[] weeklyMeans;
        private double[] weeklyStds;
        private long[] weeklyCounts;
        private double globalMean;
        private double globalStd;
        private double hourlyStrength;
        private double dailyStrength;
        private double weeklyStrength;
        private boolean hasHourlyPattern;
        private boolean hasDailyPattern;
        private boolean hasWeeklyPattern;
        private SeasonalPeriod dominantPeriod;
        private boolean insufficientHistory;
        private Instant validFrom;
        private Instant validTo;
        private long sampleCount;
        private String zoneId;

        private Builder(String service, String metricName) {
            this.service = service;
            this.metricName = metricName;
        }

        public Builder buckets(SeasonalPeriod period, double[] means, double[] stds, long[] counts) {
            switch (period) {
                case HOURLY -> {
                    hourlyMeans = means;
                    hourlyStds = stds;
                    hourlyCounts = counts;
                }
                case DAILY -> {
                    dailyMeans = means;
                    dailyStds = stds;
                    dailyCounts = counts;
                }
                case WEEKLY -> {
                    weeklyMeans = means;
                    weeklyStds = stds;
                    weeklyCounts = counts;
                }
                case NONE -> throw new IllegalArgumentException("NONE has no buckets");
            }
            return this;
        }

        public Builder pattern(SeasonalPeriod period, double strength, boolean present) {
            switch (period) {
                case HOURLY -> {
                    hourlyStrength = strength;
                    hasHourlyPattern = present;
                }
                case DAILY -> {
                    dailyStrength = strength;
                    hasDailyPattern = present;
                }
                case WEEKLY -> {
                    weeklyStrength = strength;
                    hasWeeklyPattern = present;
                }
                case NONE -> throw new IllegalArgumentException("NONE has no strength");
            }
            return this;
        }

        public Builder global(double mean, double std) {
            this.globalMean = mean;
            this.globalStd = std;
            return this;
        }

        public Builder dominantPeriod(SeasonalPeriod dominantPeriod) {
            this.dominantPeriod = dominantPeriod;
            return this;
        }

        public Builder insufficientHistory(boolean insufficientHistory) {
            this.insufficientHistory = insufficientHistory;
            return this;
        }

        public Builder validity(Instant validFrom, Instant validTo) {
            this.validFrom = validFrom;
            this.validTo = validTo;
            return this;
        }

        public Builder sampleCount(long sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder zoneId(String zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public SeasonalBaseline build() {
            return new SeasonalBaseline(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalBaseline that))
            return false;
        return sampleCount == that.sampleCount
                && service.equals(that.service)
                && metricName.equals(that.metricName)
                && validFrom.equals(that.validFrom)
                && Arrays.equals(hourlyMeans, that.hourlyMeans)
                && Arrays.equals(weeklyMeans, that.weeklyMeans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, metricName, validFrom, sampleCount);
    }

    @Override
    public String toString() {
        return "SeasonalBaseline{" +
                "series=" + service + '|' + metricName +
                ", samples=" + sampleCount +
                ", dominant=" + dominantPeriod.label() +
                ", strengths=[" + hourlyStrength + ", " + dailyStrength + ", " + weeklyStrength + ']' +
                ", global=" + globalMean + "±" + globalStd +
                ", insufficientHistory=" + insufficientHistory +
                ", validFrom=" + validFrom +
                '}';
    }
}
