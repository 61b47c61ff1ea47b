package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Current state of one SLO. Replaced wholesale on every tick, keyed by
 * {@code sloId} (last write wins).
 *
 * @since 1.0.0
 */
public final class SloStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sloId;
    private final String service;
    private final Instant updatedAt;

    /** Good percentage over the budget window, {@code null} before any event. */
    private final Double currentAttainment;

    private final double errorBudgetConsumedPercent;
    private final double errorBudgetRemainingPercent;

    /** {@code null} when the budget is not burning. */
    private final Instant projectedExhaustion;

    private final AlertStatus alertStatus;
    private final double burnRate1h;
    private final double burnRate6h;
    private final double burnRate24h;
    private final boolean dataInsufficient;
    private final boolean stale;
    private final String message;

    private SloStatus(Builder b) {
        this.sloId = Objects.requireNonNull(b.sloId, "sloId must not be null");
        this.updatedAt = Objects.requireNonNull(b.updatedAt, "updatedAt must not be null");
        this.alertStatus = Objects.requireNonNull(b.alertStatus, "alertStatus must not be null");
        this.service = b.service;
        this.currentAttainment = b.currentAttainment;
        this.errorBudgetConsumedPercent = b.errorBudgetConsumedPercent;
        this.errorBudgetRemainingPercent = b.errorBudgetRemainingPercent;
        this.projectedExhaustion = b.projectedExhaustion;
        this.burnRate1h = b.burnRate1h;
        this.burnRate6h = b.burnRate6h;
        this.burnRate24h = b.burnRate24h;
        this.dataInsufficient = b.dataInsufficient;
        this.stale = b.stale;
        this.message = b.message;
    }

    public static Builder builder(String sloId) {
        return new Builder(sloId);
    }

    /**
     * @return a builder pre-populated with this status
     */
    public Builder toBuilder() {
        Builder b = new Builder(sloId);
        b.service = service;
        b.updatedAt = updatedAt;
        b.currentAttainment = currentAttainment;
        b.errorBudgetConsumedPercent = errorBudgetConsumedPercent;
        b.errorBudgetRemainingPercent = errorBudgetRemainingPercent;
        b.projectedExhaustion = projectedExhaustion;
        b.alertStatus = alertStatus;
        b.burnRate1h = burnRate1h;
        b.burnRate6h = burnRate6h;
        b.burnRate24h = burnRate24h;
        b.dataInsufficient = dataInsufficient;
        b.stale = stale;
        b.message = message;
        return b;
    }

    public static class Builder {
        private final String sloId;
        private String service;
        private Instant updatedAt;
        private Double currentAttainment;
        private double errorBudgetConsumedPercent;
        private double errorBudgetRemainingPercent = 100.0;
        private Instant projectedExhaustion;
        private AlertStatus alertStatus = AlertStatus.OK;
        private double burnRate1h;
        private double burnRate6h;
        private double burnRate24h;
        private boolean dataInsufficient;
        private boolean stale;
        private String message;

        private Builder(String sloId) {
            this.sloId = sloId;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder currentAttainment(Double currentAttainment) {
            this.currentAttainment = currentAttainment;
            return this;
        }

        public Builder errorBudget(double consumedPercent, double remainingPercent) {
            this.errorBudgetConsumedPercent = consumedPercent;
            this.errorBudgetRemainingPercent = remainingPercent;
            return this;
        }

        public Builder projectedExhaustion(Instant projectedExhaustion) {
            this.projectedExhaustion = projectedExhaustion;
            return this;
        }

        public Builder alertStatus(AlertStatus alertStatus) {
            this.alertStatus = alertStatus;
            return this;
        }

        public Builder burnRates(double oneHour, double sixHours, double oneDay) {
            this.burnRate1h = oneHour;
            this.burnRate6h = sixHours;
            this.burnRate24h = oneDay;
            return this;
        }

        public Builder dataInsufficient(boolean dataInsufficient) {
            this.dataInsufficient = dataInsufficient;
            return this;
        }

        public Builder stale(boolean stale) {
            this.stale = stale;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public SloStatus build() {
            return new SloStatus(this);
        }
    }

    public String getSloId() {
        return sloId;
    }

    public String getService() {
        return service;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Double getCurrentAttainment() {
        return currentAttainment;
    }

    public double getErrorBudgetConsumedPercent() {
        return errorBudgetConsumedPercent;
    }

    public double getErrorBudgetRemainingPercent() {
        return errorBudgetRemainingPercent;
    }

    public Instant getProjectedExhaustion() {
        return projectedExhaustion;
    }

    public AlertStatus getAlertStatus() {
        return alertStatus;
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

    public boolean isStale() {
        return stale;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloStatus that))
            return false;
        return Double.compare(that.errorBudgetRemainingPercent, errorBudgetRemainingPercent) == 0
                && dataInsufficient == that.dataInsufficient
                && stale == that.stale
                && sloId.equals(that.sloId)
                && updatedAt.equals(that.updatedAt)
                && alertStatus == that.alertStatus
                && Objects.equals(currentAttainment, that.currentAttainment)
                && Objects.equals(projectedExhaustion, that.projectedExhaustion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sloId, updatedAt, alertStatus, currentAttainment);
    }

    @Override
    public String toString() {
        return "SloStatus{" +
                "sloId='" + sloId + '\'' +
                ", updatedAt=" + updatedAt +
                ", alertStatus=" + alertStatus +
                ", attainment=" + currentAttainment +
                ", budgetRemaining=" + errorBudgetRemainingPercent + "%" +
                (stale ? ", stale" : "") +
                (dataInsufficient ? ", data-insufficient" : "") +
                '}';
    }
}
