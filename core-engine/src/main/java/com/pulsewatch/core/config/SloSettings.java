package com.pulsewatch.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SLO evaluation settings ({@code slo:} section).
 *
 * @since 1.0.0
 */
public class SloSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Consecutive clear ticks required before an alert returns to OK. */
    private int hysteresisTicks = 3;

    /** Short window that must corroborate a fast burn. */
    private int corroborationMinutes = 5;

    /** The 24h burn must exceed {@code burnRateSlow} times this factor for a warning. */
    private double slowCorroborationFactor = 0.5;

    private int tickSeconds = 60;

    public List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (hysteresisTicks < 1) {
            errors.add("slo.hysteresisTicks must be >= 1");
        }
        if (corroborationMinutes < 1 || corroborationMinutes >= 60) {
            errors.add("slo.corroborationMinutes must be in [1, 60)");
        }
        if (!(slowCorroborationFactor > 0) || slowCorroborationFactor > 1) {
            errors.add("slo.slowCorroborationFactor must be in (0, 1]");
        }
        if (tickSeconds < 1) {
            errors.add("slo.tickSeconds must be >= 1");
        }
        return errors;
    }

    public Duration tick() {
        return Duration.ofSeconds(tickSeconds);
    }

    public int getHysteresisTicks() {
        return hysteresisTicks;
    }

    public void setHysteresisTicks(int hysteresisTicks) {
        this.hysteresisTicks = hysteresisTicks;
    }

    public int getCorroborationMinutes() {
        return corroborationMinutes;
    }

    public void setCorroborationMinutes(int corroborationMinutes) {
        this.corroborationMinutes = corroborationMinutes;
    }

    public double getSlowCorroborationFactor() {
        return slowCorroborationFactor;
    }

    public void setSlowCorroborationFactor(double slowCorroborationFactor) {
        this.slowCorroborationFactor = slowCorroborationFactor;
    }

    public int getTickSeconds() {
        return tickSeconds;
    }

    public void setTickSeconds(int tickSeconds) {
        this.tickSeconds = tickSeconds;
    }
}
