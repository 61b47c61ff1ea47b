package com.pulsewatch.core.slo;

import com.pulsewatch.core.config.SloSettings;
import com.pulsewatch.core.model.AlertStatus;
import com.pulsewatch.core.model.SloDefinition;

import java.io.Serializable;
import java.util.Objects;

/**
 * Burn-rate alert state of one SLO with its hysteresis counter.
 *
 * <h3>Transitions</h3>
 * <ul>
 * <li>OK to CRITICAL: 1h burn and the corroboration-window burn both exceed
 * {@code burnRateFast}</li>
 * <li>OK to WARNING: 6h burn exceeds {@code burnRateSlow} and 24h burn exceeds
 * {@code burnRateSlow * slowCorroborationFactor}</li>
 * <li>WARNING to CRITICAL: the fast condition holds</li>
 * <li>CRITICAL or WARNING to OK: after {@code hysteresisTicks} consecutive
 * ticks in which the condition that raised the alert is false; the count
 * restarts whenever the condition reappears</li>
 * </ul>
 * <p>
 * Instances are immutable; {@link #transition} is a pure function.
 * </p>
 *
 * @since 1.0.0
 */
public final class SloAlertState implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final SloAlertState OK = new SloAlertState(AlertStatus.OK, 0);

    private final AlertStatus status;
    private final int clearTicks;

    public SloAlertState(AlertStatus status, int clearTicks) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        if (clearTicks < 0) {
            throw new IllegalArgumentException("clearTicks must be >= 0");
        }
        this.clearTicks = clearTicks;
    }

    public static SloAlertState initial() {
        return OK;
    }

    public static boolean fastBurn(BurnRates rates, SloDefinition definition) {
        return rates.oneHour() > definition.getBurnRateFast()
                && rates.corroboration() > definition.getBurnRateFast();
    }

    public static boolean slowBurn(BurnRates rates, SloDefinition definition, SloSettings settings) {
        return rates.sixHours() > definition.getBurnRateSlow()
                && rates.oneDay() > definition.getBurnRateSlow() * settings.getSlowCorroborationFactor();
    }

    public static SloAlertState transition(SloAlertState current, BurnRates rates,
            SloDefinition definition, SloSettings settings) {
        return current.next(fastBurn(rates, definition), slowBurn(rates, definition, settings),
                settings.getHysteresisTicks());
    }

    /**
     * @param fast       whether the fast-burn condition holds this tick
     * @param slow       whether the slow-burn condition holds this tick
     * @param hysteresis consecutive clear ticks required to return to OK
     * @return the state after this tick
     */
    public SloAlertState next(boolean fast, boolean slow, int hysteresis) {
        return switch (status) {
            case OK -> {
                if (fast) {
                    yield new SloAlertState(AlertStatus.CRITICAL, 0);
                }
                yield slow ? new SloAlertState(AlertStatus.WARNING, 0) : OK;
            }
            case WARNING -> {
                if (fast) {
                    yield new SloAlertState(AlertStatus.CRITICAL, 0);
                }
                yield clearOrHold(slow, hysteresis);
            }
            case CRITICAL -> clearOrHold(fast, hysteresis);
        };
    }

    private SloAlertState clearOrHold(boolean conditionHolds, int hysteresis) {
        if (conditionHolds) {
            return clearTicks == 0 ? this : new SloAlertState(status, 0);
        }
        int cleared = clearTicks + 1;
        return cleared >= hysteresis ? OK : new SloAlertState(status, cleared);
    }

    public AlertStatus status() {
        return status;
    }

    public int clearTicks() {
        return clearTicks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloAlertState that))
            return false;
        return clearTicks == that.clearTicks && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, clearTicks);
    }

    @Override
    public String toString() {
        return status.label() + (clearTicks > 0 ? " (clear " + clearTicks + ")" : "");
    }
}
