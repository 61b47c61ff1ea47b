package com.pulsewatch.core.logs;

import com.pulsewatch.core.config.LogMiningSettings;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.LogTemplate;
import com.pulsewatch.core.model.Severity;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the outcome of placing a line into at most one pattern anomaly.
 *
 * <p>
 * Priority: {@code new_pattern}, {@code frequency_spike},
 * {@code frequency_drop}, {@code unexpected_transition}, then
 * {@code pattern_transition}. Events on error-looking templates are raised
 * one severity level higher, except drops, which are lowered.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternAnomalyDetector {

    static final double NEW_PATTERN_SCORE = 0.6;
    static final double NEW_ERROR_PATTERN_SCORE = 0.8;
    static final double UNSEEN_TRANSITION_SCORE = 0.9;
    private static final double SCORE_SATURATION_SIGMA = 6.0;

    private PatternAnomalyDetector() {
    }

    public static Optional<AnomalyEvent> evaluate(ServiceTemplateSet.Placement placement, Instant timestamp,
            LogMiningSettings settings) {
        LogTemplate t = placement.template();
        if (placement.created()) {
            boolean error = t.isErrorPattern();
            return Optional.of(base(t, timestamp, DetectionMethod.NEW_PATTERN)
                    .observed(1)
                    .expected(0)
                    .score(error ? NEW_ERROR_PATTERN_SCORE : NEW_PATTERN_SCORE)
                    .confidence(1.0)
                    .severity(error ? Severity.WARNING : Severity.INFO)
                    .details("New log pattern: " + t.getTemplate())
                    .build());
        }
        TemplateActivity.Deviation spike = placement.rateSpike();
        if (spike != null) {
            return Optional.of(base(t, timestamp, DetectionMethod.FREQUENCY_SPIKE)
                    .observed(spike.observed())
                    .expected(spike.expected())
                    .expectedStd(spike.std())
                    .deviationSigma(spike.sigma())
                    .score(Math.min(1.0, Math.abs(spike.sigma()) / SCORE_SATURATION_SIGMA))
                    .confidence(spike.confidence())
                    .severity(t.isErrorPattern() ? Severity.CRITICAL : Severity.WARNING)
                    .details(String.format(Locale.ROOT, "Frequency spike: %.0f/min vs %.2f +- %.2f for '%s'",
                            spike.observed(), spike.expected(), spike.std(), t.getTemplate()))
                    .build());
        }
        TemplateActivity.Deviation drop = placement.rateDrop();
        if (drop != null) {
            return Optional.of(base(t, timestamp, DetectionMethod.FREQUENCY_DROP)
                    .observed(drop.observed())
                    .expected(drop.expected())
                    .expectedStd(drop.std())
                    .deviationSigma(drop.sigma())
                    .score(Math.min(1.0, Math.abs(drop.sigma()) / SCORE_SATURATION_SIGMA))
                    .confidence(drop.confidence())
                    .severity(t.isErrorPattern() ? Severity.INFO : Severity.WARNING)
                    .details(String.format(Locale.ROOT, "Frequency drop: %.0f/min vs %.2f +- %.2f for '%s'",
                            drop.observed(), drop.expected(), drop.std(), t.getTemplate()))
                    .build());
        }
        SessionTransitions.Transition transition = placement.transition();
        if (transition != null) {
            double threshold = settings.getLowTransitionProbability();
            double score = transition.count() == 0 ? UNSEEN_TRANSITION_SCORE
                    : Math.min(1.0, threshold / transition.probability() * 0.5);
            return Optional.of(base(t, timestamp, DetectionMethod.UNEXPECTED_TRANSITION)
                    .observed(transition.probability())
                    .expected(threshold)
                    .score(score)
                    .confidence(Math.min(1.0, (double) transition.total() / (2.0 * settings.getMinTransitionCount())))
                    .severity(t.isErrorPattern() ? Severity.WARNING : Severity.INFO)
                    .details(String.format(Locale.ROOT, "Unusual transition %s -> %s (p=%.4f over %d, usually -> %s)",
                            transition.from(), transition.to(), transition.probability(), transition.total(),
                            transition.likelyNext()))
                    .build());
        }
        TemplateActivity.Deviation gap = placement.gapDeviation();
        if (gap != null) {
            return Optional.of(base(t, timestamp, DetectionMethod.PATTERN_TRANSITION)
                    .observed(gap.observed())
                    .expected(gap.expected())
                    .expectedStd(gap.std())
                    .deviationSigma(gap.sigma())
                    .score(Math.min(1.0, Math.abs(gap.sigma()) / SCORE_SATURATION_SIGMA))
                    .confidence(gap.confidence())
                    .severity(t.isErrorPattern() ? Severity.WARNING : Severity.INFO)
                    .details(String.format(Locale.ROOT, "Inter-arrival %.1fs vs %.1fs +- %.1fs for '%s'",
                            gap.observed(), gap.expected(), gap.std(), t.getTemplate()))
                    .build());
        }
        return Optional.empty();
    }

    private static AnomalyEvent.Builder base(LogTemplate t, Instant timestamp, DetectionMethod method) {
        return AnomalyEvent.builder()
                .service(t.getService())
                .metricOrPattern(t.getId())
                .timestamp(timestamp)
                .method(method);
    }
}
