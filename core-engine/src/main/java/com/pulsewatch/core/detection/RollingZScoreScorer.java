package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.BucketStatistics;
import com.pulsewatch.core.config.DetectionSettings;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Rolling z-score over a short trailing window.
 *
 * <p>
 * The reference statistics cover {@code [t - trailingWindow, t - exclusion)}
 * so the most recent interval, which may already be part of the anomaly,
 * does not dilute it. {@code z = (observed - mean) / std}, and a zero std
 * yields {@code z = 0}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * No event is produced until the reference interval holds at least
 * {@code minWindowSamples} observations.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingZScoreScorer implements MetricScorer {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RollingZScoreScorer.class);

    /** Deviation at which the score saturates at 1. */
    static final double SCORE_SATURATION_SIGMA = 6.0;

    private final TrailingWindow window;
    private final long trailingMillis;
    private final long exclusionMillis;
    private final int minWindowSamples;
    private final int fullConfidenceSamples;
    private final double warningSigma;
    private final double criticalSigma;

    public RollingZScoreScorer(TrailingWindow window, DetectionSettings settings,
            double warningSigma, double criticalSigma, int fullConfidenceSamples) {
        this(window, settings.trailingWindow(), settings.exclusion(), settings.getMinWindowSamples(),
                warningSigma, criticalSigma, fullConfidenceSamples);
    }

    public RollingZScoreScorer(TrailingWindow window, Duration trailingWindow, Duration exclusion,
            int minWindowSamples, double warningSigma, double criticalSigma, int fullConfidenceSamples) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.trailingMillis = trailingWindow.toMillis();
        this.exclusionMillis = exclusion.toMillis();
        if (exclusionMillis >= trailingMillis) {
            throw new IllegalArgumentException("exclusion must be shorter than the trailing window");
        }
        this.minWindowSamples = minWindowSamples;
        this.warningSigma = warningSigma;
        this.criticalSigma = criticalSigma;
        this.fullConfidenceSamples = Math.max(1, fullConfidenceSamples);
    }

    @Override
    public Optional<AnomalyEvent> score(MetricSample sample, SeasonalBaseline baseline) {
        Objects.requireNonNull(sample, "sample must not be null");
        Instant ts = sample.getTimestamp();
        Optional<AnomalyEvent> result = Optional.empty();

        BucketStatistics reference = window.statistics(ts.minusMillis(trailingMillis), ts.minusMillis(exclusionMillis));
        if (reference.count() >= minWindowSamples) {
            double mean = reference.mean();
            double std = reference.std();
            double z = zScore(sample.getValue(), mean, std);
            Severity severity = Severity.fromSigma(Math.abs(z), warningSigma, criticalSigma);
            if (severity != null) {
                LOG.debug("z-score fired for {}: value={} mean={} std={} z={}",
                        sample.seriesKey(), sample.getValue(), mean, std, z);
                result = Optional.of(AnomalyEvent.builder()
                        .service(sample.getService())
                        .metricOrPattern(sample.getMetricName())
                        .timestamp(ts)
                        .observed(sample.getValue())
                        .expected(mean)
                        .expectedStd(std)
                        .deviationSigma(z)
                        .score(Math.min(1.0, Math.abs(z) / SCORE_SATURATION_SIGMA))
                        .confidence(Math.min(1.0, (double) reference.count() / fullConfidenceSamples))
                        .method(DetectionMethod.ZSCORE)
                        .severity(severity)
                        .details(String.format(Locale.ROOT,
                                "Rolling z-score %.2f over %d samples (mean=%.2f, std=%.2f)",
                                z, reference.count(), mean, std))
                        .build());
            }
        }

        // Append after scoring so the sample never influences its own reference
        if (Double.isFinite(sample.getValue())) {
            window.append(ts, sample.getValue());
        }
        return result;
    }

    static double zScore(double observed, double mean, double std) {
        if (std == 0.0) {
            return 0.0;
        }
        return (observed - mean) / std;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }

    public TrailingWindow window() {
        return window;
    }
}
