package com.pulsewatch.core.slo;

import com.pulsewatch.core.config.SloSettings;
import com.pulsewatch.core.error.InvalidConfigurationException;
import com.pulsewatch.core.model.AlertStatus;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SloEvaluator}.
 */
class SloEvaluatorTest {

    private static final Instant T0 = Instant.parse("2026-05-04T10:00:00Z");
    private static final String SLO = "checkout-availability";

    private SloEvaluator evaluator;

    @BeforeEach
    void setUp() {
        SloDefinition def = new SloDefinition(SLO, "checkout", "http_status", "availability", 500, "lt", 99.9, 30);
        evaluator = new SloEvaluator(List.of(def), new SloSettings());
    }

    @Test
    @DisplayName("Should NOT fire critical at a 10x burn rate")
    void shouldNotFireCriticalBelowFastThreshold() {
        SloEvaluation result = evaluator.evaluate(SLO, 5940, 60, T0);

        SloMeasurement m = result.measurement();
        assertThat(m.getTotalCount()).isEqualTo(6000);
        assertThat(m.getSliValue()).isCloseTo(0.99, within(1e-12));
        assertThat(m.getBurnRate1h()).isCloseTo(10.0, within(1e-6));
        assertThat(result.status().getAlertStatus()).isNotEqualTo(AlertStatus.CRITICAL);
        // 6h and 24h windows burn at 10 as well
        assertThat(result.status().getAlertStatus()).isEqualTo(AlertStatus.WARNING);
        assertThat(result.status().getMessage()).startsWith("Slow burn");
    }

    @Test
    @DisplayName("Should leave the SLO untouched until a prepared tick is committed")
    void shouldApplyPreparedTickOnlyOnCommit() {
        SloEvaluator.PendingEvaluation pending = evaluator.prepare(SLO, 5910, 90, T0);

        assertThat(pending.evaluation().status().getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(evaluator.currentStatus(SLO)).isEmpty();

        assertThat(evaluator.commit(pending)).isTrue();
        assertThat(evaluator.currentStatus(SLO)).contains(pending.evaluation().status());
    }

    @Test
    @DisplayName("Should drop a prepared tick whose state was replaced in the meantime")
    void shouldRejectCommitOfOutdatedTick() {
        SloEvaluator.PendingEvaluation older = evaluator.prepare(SLO, 0, 6000, T0);
        SloEvaluator.PendingEvaluation newer = evaluator.prepare(SLO, 6000, 0, T0.plusSeconds(60));

        assertThat(evaluator.commit(newer)).isTrue();
        assertThat(evaluator.commit(older)).isFalse();

        SloStatus status = evaluator.currentStatus(SLO).orElseThrow();
        assertThat(status.getAlertStatus()).isEqualTo(AlertStatus.OK);
        assertThat(status.getCurrentAttainment()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should fire critical at a 15x burn rate and clear after three calm ticks")
    void shouldFireCriticalAndClearWithHysteresis() {
        SloEvaluation fired = evaluator.evaluate(SLO, 5910, 90, T0);

        assertThat(fired.measurement().getBurnRate1h()).isCloseTo(15.0, within(1e-6));
        assertThat(fired.measurement().getBurnRate5m()).isCloseTo(15.0, within(1e-6));
        assertThat(fired.status().getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(fired.status().getMessage()).startsWith("Fast burn");

        assertThat(tick(1, 6000, 0).getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(tick(2, 6000, 0).getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        SloStatus cleared = tick(3, 6000, 0);
        assertThat(cleared.getAlertStatus()).isEqualTo(AlertStatus.OK);
        assertThat(cleared.getBurnRate1h()).isCloseTo(3.75, within(1e-6));
        assertThat(cleared.getMessage()).isNull();
    }

    @Test
    @DisplayName("Should restart the clear count when the fast burn reappears")
    void shouldRestartHysteresis() {
        evaluator.evaluate(SLO, 5910, 90, T0);
        tick(1, 6000, 0);
        tick(2, 6000, 0);
        // 1h burn (90 + 600) / 24000 / 0.001 = 28.75, the 5m window agrees
        assertThat(tick(3, 5400, 600).getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(tick(4, 600000, 0).getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
    }

    @Test
    @DisplayName("Should hold the alert status and flag ticks without events")
    void shouldHoldStatusOnEmptyTick() {
        evaluator.evaluate(SLO, 5910, 90, T0);
        tick(1, 6000, 0);

        SloEvaluation empty = evaluator.evaluate(SLO, 0, 0, T0.plus(Duration.ofMinutes(2)));

        assertThat(empty.measurement().isDataInsufficient()).isTrue();
        assertThat(empty.measurement().getSliValue()).isNull();
        assertThat(empty.status().isDataInsufficient()).isTrue();
        assertThat(empty.status().getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(empty.status().getUpdatedAt()).isEqualTo(T0.plus(Duration.ofMinutes(2)));

        // the empty tick did not count towards the three clear ticks
        assertThat(tick(3, 6000, 0).getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(tick(4, 6000, 0).getAlertStatus()).isEqualTo(AlertStatus.OK);
    }

    @Test
    @DisplayName("Should report insufficient data before the first event")
    void shouldHandleFirstTickWithoutEvents() {
        SloStatus status = evaluator.evaluate(SLO, 0, 0, T0).status();

        assertThat(status.getAlertStatus()).isEqualTo(AlertStatus.OK);
        assertThat(status.isDataInsufficient()).isTrue();
        assertThat(status.getCurrentAttainment()).isNull();
    }

    @Test
    @DisplayName("Should compute budget consumption and projected exhaustion")
    void shouldProjectExhaustion() {
        SloStatus status = evaluator.evaluate(SLO, 9999, 1, T0).status();

        assertThat(status.getCurrentAttainment()).isCloseTo(99.99, within(1e-9));
        assertThat(status.getErrorBudgetConsumedPercent()).isCloseTo(10.0, within(1e-6));
        assertThat(status.getErrorBudgetRemainingPercent()).isCloseTo(90.0, within(1e-6));
        // 90% of a 30 day budget burning at 0.1x lasts 270 days
        assertThat(Duration.between(T0, status.getProjectedExhaustion()).toHours())
                .isCloseTo(270L * 24, within(1L));

        SloStatus exhausted = evaluator.evaluate(SLO, 0, 6000, T0.plus(Duration.ofMinutes(1))).status();
        assertThat(exhausted.getErrorBudgetRemainingPercent()).isZero();
        assertThat(exhausted.getProjectedExhaustion()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Should omit projected exhaustion when nothing burns")
    void shouldOmitProjectionWithoutBurn() {
        SloStatus status = evaluator.evaluate(SLO, 1000, 0, T0).status();

        assertThat(status.getProjectedExhaustion()).isNull();
        assertThat(status.getErrorBudgetRemainingPercent()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should republish the last status flagged stale")
    void shouldMarkStale() {
        evaluator.evaluate(SLO, 5910, 90, T0);

        SloStatus stale = evaluator.markStale(SLO, T0.plus(Duration.ofMinutes(1)));

        assertThat(stale.isStale()).isTrue();
        assertThat(stale.getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(evaluator.currentStatus(SLO)).contains(stale);
        assertThat(evaluator.evaluate(SLO, 6000, 0, T0.plus(Duration.ofMinutes(2))).status().isStale()).isFalse();
    }

    @Test
    @DisplayName("Should reject unknown SLOs and negative counts")
    void shouldRejectBadInput() {
        assertThatThrownBy(() -> evaluator.evaluate("nope", 1, 0, T0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> evaluator.evaluate(SLO, -1, 0, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should exclude invalid definitions and keep evaluating the rest")
    void shouldExcludeInvalidDefinitions() {
        SloDefinition broken = new SloDefinition("broken", "checkout", "m", "latency", 1, "lt", 100.0, 30);
        SloDefinition fine = new SloDefinition("fine", "checkout", "m", "latency", 1, "lt", 99.0, 7);
        SloEvaluator mixed = new SloEvaluator(List.of(broken, fine), new SloSettings());

        assertThat(mixed.definitions()).extracting(SloDefinition::getId).containsExactly("fine");
        assertThatThrownBy(() -> mixed.evaluate("broken", 1, 0, T0))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThat(mixed.evaluate("fine", 99, 1, T0).status().getAlertStatus()).isEqualTo(AlertStatus.OK);
    }

    private SloStatus tick(int minute, long good, long bad) {
        return evaluator.evaluate(SLO, good, bad, T0.plus(Duration.ofMinutes(minute))).status();
    }
}
