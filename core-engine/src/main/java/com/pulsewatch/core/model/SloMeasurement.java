package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One SLO evaluation tick. Append-only, never mutated after creation.
 *
 * <p>
 * {@code sliValue} is {@code null} when the tick carried no events; the
 * measurement is then flagged {@code dataInsufficient}. Burn rates of a
 * window with no events are {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SloMeasurement implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sloId;
    private final Instant timestamp;
    private final long totalCount;
    private final long goodCount;
    private final long badCount;
    private final Double sliValue;
    private final double errorBudgetConsumed;
    private final double errorBudgetRemaining;
    private final double burnRate5m;
    private final double burnRate1h;
    private final double burnRate6h;
    private final double burnRate24h;
    private final boolean dataInsufficient;

    private SloMeasurement(Builder b) {
        this.sloId = Objects.requireNonNull(b.sloId, "sloId must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.goodCount = b.goodCount;
        this.badCount = b.badCount;
        this.totalCount = b.goodCount + b.badCount;
        this.sliValue = totalCount == 0 ? null : (double) goodCount / totalCount;
        this.errorBudgetConsumed = b.errorBudgetConsumed;
        this.errorBudgetRemaining = b.errorBudgetRemaining;
        this.burnRate5m = b.burnRate5m;
        this.burnRate1h = b.burnRate1h;
        this.burnRate6h = b.burnRate6h;
        this.burnRate24h = b.burnRate24h;
        this.dataInsufficient = totalCount == 0;
    }

    public static Builder builder(String sloId, Instant timestamp) {
        return new Builder(sloId, timestamp);
    }

    public static class Builder {
        private final String sloId;
        private final Instant timestamp;
        private long goodCount;
        private long badCount;
        private double errorBudgetConsumed;
        private double errorBudgetRemaining = 100.0;
        private double burnRate5m;
        private double burnRate1h;
        private double burnRate6h;
        private double burnRate24h;

        private Builder(String sloId, Instant timestamp) {
            this.sloId = sloId;
            this.timestamp = timestamp;
        }

        public Builder counts(long goodCount, long badCount) {
            if (goodCount < 0 || badCount < 0) {
                throw new IllegalArgumentException("counts must be >= 0, got good=" + goodCount
                        + " bad=" + badCount);
            }
            this.goodCount = goodCount;
            this.badCount = badCount;
            return this;
        }

        /**
         * @param consumed  percent of the budget consumed, may exceed 100
         * @param remaining percent of the budget left, in {@code [0, 100]}
         */
        public Builder errorBudget(double consumed, double remaining) {
            this.errorBudgetConsumed = consumed;
            this.errorBudgetRemaining = remaining;
            return this;
        }

        public Builder burnRates(double fiveMinutes, double oneHour, double sixHours, double oneDay) {
            this.burnRate5m = fiveMinutes;
            this.burnRate1h = oneHour;
            this.burnRate6h = sixHours;
            this.burnRate24h = oneDay;
            return this;
        }

        public SloMeasurement build() {
            return new SloMeasurement(this);
        }
    }

    public String getSloId() {
        return sloId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public long getGoodCount() {
        return goodCount;
    }

    public long getBadCount() {
        return badCount;
    }

    public Double getSliValue() {
        return sliValue;
    }

    public double getErrorBudgetConsumed() {
        return errorBudgetConsumed;
    }

    public double getErrorBudgetRemaining() {
        return errorBudgetRemaining;
    }

    public double getBurnRate5m() {
        return burnRate5m;
    }

    public double getBurnRate1h() {
        return burnRate1h;
    }

    public double getBurnRate6h() {
        return burnRate6h;
    }

    public double getBurnRate24h() {
        return burnRate24h;
    }

    public boolean isDataInsufficient() {
        return dataInsufficient;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloMeasurement that))
            return false;
        return totalCount == that.totalCount
                && goodCount == that.goodCount
                && badCount == that.badCount
                && Double.compare(that.errorBudgetConsumed, errorBudgetConsumed) == 0
                && Double.compare(that.burnRate1h, burnRate1h) == 0
                && Double.compare(that.burnRate6h, burnRate6h) == 0
                && Double.compare(that.burnRate24h, burnRate24h) == 0
                && sloId.equals(that.sloId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sloId, timestamp, goodCount, badCount, burnRate1h);
    }

    @Override
    public String toString() {
        return "SloMeasurement{" +
                "sloId='" + sloId + '\'' +
                ", timestamp=" + timestamp +
                ", good=" + goodCount +
                ", bad=" + badCount +
                ", sli=" + sliValue +
                ", burn1h=" + burnRate1h +
                ", burn6h=" + burnRate6h +
                ", burn24h=" + burnRate24h +
                (dataInsufficient ? ", data-insufficient" : "") +
                '}';
    }
}
