package com.pulsewatch.core.slo;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.config.SloSettings;
import com.pulsewatch.core.error.InvalidConfigurationException;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Evaluates SLO compliance, error budget and multi-window burn-rate alerts
 * once per tick.
 *
 * <h3>Data-insufficient ticks</h3>
 * <p>
 * A tick with no events records nothing, neither fires nor clears an alert,
 * does not advance the hysteresis counter, and republishes the previous
 * status flagged {@code dataInsufficient}.
 * </p>
 *
 * <h3>Isolation</h3>
 * <p>
 * Each SLO has its own {@link SloState}; a failure evaluating one SLO never
 * touches another. Ticks of one SLO must be evaluated by a single owner at a
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public class SloEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SloEvaluator.class);

    private final SloSettings settings;
    private final Map<String, SloDefinition> definitions;
    private final ConcurrentMap<String, SloState> states = new ConcurrentHashMap<>();

    public SloEvaluator(AnalyticsConfig config) {
        this(config.getSlos(), config.getSlo());
    }

    /**
     * @param definitions SLO definitions; invalid ones are excluded
     * @param settings    evaluation settings
     */
    public SloEvaluator(List<SloDefinition> definitions, SloSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        Map<String, SloDefinition> valid = new LinkedHashMap<>();
        for (SloDefinition def : definitions) {
            try {
                def.validate();
                valid.putIfAbsent(def.getId(), def);
            } catch (InvalidConfigurationException e) {
                LOG.warn("SLO excluded from evaluation: {}", e.getMessage());
            }
        }
        this.definitions = Collections.unmodifiableMap(valid);
        LOG.info("SLO evaluator ready with {} SLO(s)", this.definitions.size());
    }

    /**
     * Evaluate one tick.
     *
     * @param sloId     SLO id
     * @param goodCount good events of the tick
     * @param badCount  bad events of the tick
     * @param timestamp tick time
     * @return the measurement and the new current status
     * @throws InvalidConfigurationException if the SLO is unknown or excluded
     */
    public SloEvaluation evaluate(String sloId, long goodCount, long badCount, Instant timestamp) {
        SloDefinition def = definition(sloId);
        SloState state = states.computeIfAbsent(sloId, id -> new SloState(def));
        return evaluate(def, state, settings, goodCount, badCount, timestamp);
    }

    /**
     * Evaluate one tick on a copy of the current state. Counters and alert
     * state only change once the result is passed to {@link #commit}.
     *
     * @throws InvalidConfigurationException if the SLO is unknown or excluded
     */
    public PendingEvaluation prepare(String sloId, long goodCount, long badCount, Instant timestamp) {
        SloDefinition def = definition(sloId);
        SloState base = states.computeIfAbsent(sloId, id -> new SloState(def));
        SloState next = base.copy();
        SloEvaluation evaluation = evaluate(def, next, settings, goodCount, badCount, timestamp);
        return new PendingEvaluation(sloId, base, next, evaluation);
    }

    /**
     * Make a prepared tick the current state of its SLO.
     *
     * @return {@code false} if the state changed since the tick was prepared;
     *         nothing is applied in that case
     */
    public boolean commit(PendingEvaluation pending) {
        Objects.requireNonNull(pending, "pending must not be null");
        return states.replace(pending.sloId(), pending.base(), pending.next());
    }

    /**
     * A tick evaluated against a private copy of the SLO state.
     */
    public record PendingEvaluation(String sloId, SloState base, SloState next, SloEvaluation evaluation) {
    }

    /**
     * Evaluate one tick against explicitly owned state.
     */
    public static SloEvaluation evaluate(SloDefinition def, SloState state, SloSettings settings,
            long goodCount, long badCount, Instant timestamp) {
        Objects.requireNonNull(def, "definition must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (goodCount < 0 || badCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0, got good=" + goodCount + " bad=" + badCount);
        }

        if (goodCount + badCount == 0) {
            return insufficient(def, state, timestamp);
        }

        state.minutes().add(timestamp, goodCount, badCount);
        state.hours().add(timestamp, goodCount, badCount);

        double budget = def.errorBudgetFraction();
        BurnRates rates = burnRates(state, settings, budget, timestamp);

        long[] window = state.hours().sum(timestamp, state.hours().buckets());
        long windowTotal = window[0] + window[1];
        double consumed = windowTotal == 0 ? 0.0 : ((double) window[1] / windowTotal) / budget * 100.0;
        double remaining = Math.max(0.0, Math.min(100.0, 100.0 - consumed));
        Double attainment = windowTotal == 0 ? null : (double) window[0] / windowTotal * 100.0;

        SloAlertState previous = state.alert();
        SloAlertState next = SloAlertState.transition(previous, rates, def, settings);
        state.alert(next);
        if (previous.status() != next.status()) {
            LOG.info("SLO {} alert {} -> {} (burn 5m={} 1h={} 6h={} 24h={})", def.getId(),
                    previous.status().label(), next.status().label(), fmt(rates.corroboration()),
                    fmt(rates.oneHour()), fmt(rates.sixHours()), fmt(rates.oneDay()));
        }

        SloMeasurement measurement = SloMeasurement.builder(def.getId(), timestamp)
                .counts(goodCount, badCount)
                .errorBudget(consumed, remaining)
                .burnRates(rates.corroboration(), rates.oneHour(), rates.sixHours(), rates.oneDay())
                .build();

        SloStatus status = SloStatus.builder(def.getId())
                .service(def.getService())
                .updatedAt(timestamp)
                .currentAttainment(attainment)
                .errorBudget(consumed, remaining)
                .projectedExhaustion(projectedExhaustion(timestamp, remaining, rates.oneHour(), def))
                .alertStatus(next.status())
                .burnRates(rates.oneHour(), rates.sixHours(), rates.oneDay())
                .message(message(next, rates, def, settings))
                .build();
        state.lastStatus(status);
        return new SloEvaluation(measurement, status);
    }

    private static SloEvaluation insufficient(SloDefinition def, SloState state, Instant timestamp) {
        SloMeasurement measurement = SloMeasurement.builder(def.getId(), timestamp)
                .counts(0, 0)
                .errorBudget(
                        state.lastStatus() != null ? state.lastStatus().getErrorBudgetConsumedPercent() : 0.0,
                        state.lastStatus() != null ? state.lastStatus().getErrorBudgetRemainingPercent() : 100.0)
                .build();
        SloStatus held = state.lastStatus() != null
                ? state.lastStatus().toBuilder().updatedAt(timestamp).dataInsufficient(true).stale(false).build()
                : SloStatus.builder(def.getId())
                        .service(def.getService())
                        .updatedAt(timestamp)
                        .alertStatus(state.alert().status())
                        .dataInsufficient(true)
                        .message("No events in this tick")
                        .build();
        state.lastStatus(held);
        LOG.debug("SLO {} tick at {} has no events, status held at {}", def.getId(), timestamp,
                held.getAlertStatus().label());
        return new SloEvaluation(measurement, held);
    }

    static BurnRates burnRates(SloState state, SloSettings settings, double budget, Instant now) {
        long[] shortWindow = state.minutes().sum(now, settings.getCorroborationMinutes());
        long[] hour = state.minutes().sum(now, 60);
        long[] sixHours = state.minutes().sum(now, 6 * 60);
        long[] day = state.minutes().sum(now, SloState.MINUTES_PER_DAY);
        return new BurnRates(
                BurnRates.of(shortWindow[0], shortWindow[1], budget),
                BurnRates.of(hour[0], hour[1], budget),
                BurnRates.of(sixHours[0], sixHours[1], budget),
                BurnRates.of(day[0], day[1], budget));
    }

    /**
     * Time at which the remaining budget is gone if the current 1h burn rate
     * persists.
     *
     * @return {@code null} when the budget is not burning
     */
    static Instant projectedExhaustion(Instant now, double remainingPercent, double burnRate, SloDefinition def) {
        if (burnRate <= 0) {
            return null;
        }
        if (remainingPercent <= 0) {
            return now;
        }
        double windowSeconds = Duration.ofDays(def.getWindowDays()).getSeconds();
        double secondsLeft = (remainingPercent / 100.0) * windowSeconds / burnRate;
        return now.plusSeconds((long) Math.min(secondsLeft, Long.MAX_VALUE / 2.0));
    }

    private static String message(SloAlertState state, BurnRates rates, SloDefinition def, SloSettings settings) {
        return switch (state.status()) {
            case CRITICAL -> String.format(Locale.ROOT,
                    "Fast burn: 1h burn rate %.2f and %dm burn rate %.2f vs threshold %.2f",
                    rates.oneHour(), settings.getCorroborationMinutes(), rates.corroboration(),
                    def.getBurnRateFast());
            case WARNING -> String.format(Locale.ROOT,
                    "Slow burn: 6h burn rate %.2f vs threshold %.2f, 24h burn rate %.2f",
                    rates.sixHours(), def.getBurnRateSlow(), rates.oneDay());
            case OK -> null;
        };
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    // ---------------------------------------------------------------
    // Stale handling and queries
    // ---------------------------------------------------------------

    /**
     * Republish the current status of an SLO flagged stale, for a tick whose
     * counts could not be read.
     *
     * @return the stale status
     */
    public SloStatus markStale(String sloId, Instant timestamp) {
        SloDefinition def = definition(sloId);
        SloState state = states.computeIfAbsent(sloId, id -> new SloState(def));
        SloStatus stale = state.lastStatus() != null
                ? state.lastStatus().toBuilder().updatedAt(timestamp).stale(true).build()
                : SloStatus.builder(sloId).service(def.getService()).updatedAt(timestamp)
                        .alertStatus(state.alert().status()).stale(true).build();
        state.lastStatus(stale);
        return stale;
    }

    public Optional<SloStatus> currentStatus(String sloId) {
        SloState state = states.get(sloId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.lastStatus());
    }

    public SloDefinition definition(String sloId) {
        SloDefinition def = definitions.get(sloId);
        if (def == null) {
            throw new InvalidConfigurationException("Unknown or excluded SLO: '" + sloId + "'");
        }
        return def;
    }

    public Collection<SloDefinition> definitions() {
        return definitions.values();
    }

    public SloSettings settings() {
        return settings;
    }
}
