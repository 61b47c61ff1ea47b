package com.pulsewatch.core.slo;

import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloStatus;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Everything the evaluator keeps between ticks of one SLO.
 *
 * <p>
 * Minute buckets cover the 24h burn windows, hour buckets cover the error
 * budget window of {@code windowDays}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SloState implements Serializable {

    private static final long serialVersionUID = 1L;

    static final int MINUTES_PER_DAY = 24 * 60;

    private final RollingCounter minutes;
    private final RollingCounter hours;
    private SloAlertState alert = SloAlertState.initial();
    private SloStatus lastStatus;

    public SloState(SloDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        this.minutes = new RollingCounter(Duration.ofMinutes(1).toMillis(), MINUTES_PER_DAY);
        this.hours = new RollingCounter(Duration.ofHours(1).toMillis(), definition.getWindowDays() * 24);
    }

    private SloState(SloState other) {
        this.minutes = other.minutes.copy();
        this.hours = other.hours.copy();
        this.alert = other.alert;
        this.lastStatus = other.lastStatus;
    }

    /**
     * @return an independent copy; alert state and statuses are immutable and shared
     */
    public SloState copy() {
        return new SloState(this);
    }

    public RollingCounter minutes() {
        return minutes;
    }

    public RollingCounter hours() {
        return hours;
    }

    public SloAlertState alert() {
        return alert;
    }

    void alert(SloAlertState alert) {
        this.alert = alert;
    }

    /**
     * @return the last published status, {@code null} before the first tick
     */
    public SloStatus lastStatus() {
        return lastStatus;
    }

    void lastStatus(SloStatus lastStatus) {
        this.lastStatus = lastStatus;
    }
}
