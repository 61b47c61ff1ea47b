package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.baseline.SeasonalLookup;
import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.config.DetectionSettings;
import com.pulsewatch.core.config.DetectionThresholds;
import com.pulsewatch.core.model.DetectionMethod;

import java.util.Objects;

/**
 * Creates the scorers of a series from configuration.
 *
 * <p>
 * This is the single point of extension when adding a scoring method.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerFactory {

    private ScorerFactory() {
        // utility class
    }

    /**
     * Create a single scorer.
     *
     * @param method     {@link DetectionMethod#ZSCORE} or {@link DetectionMethod#SEASONAL}
     * @param thresholds effective thresholds of the series
     * @param config     analytics configuration
     * @param calendar   holiday calendar for seasonal leniency
     * @param window     trailing window to score against, used by z-score only
     * @throws IllegalArgumentException for log-pattern methods
     */
    public static MetricScorer create(DetectionMethod method, DetectionThresholds thresholds,
            AnalyticsConfig config, HolidayCalendar calendar, TrailingWindow window) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return switch (method) {
            case ZSCORE -> new RollingZScoreScorer(window, config.getDetection(),
                    thresholds.warningSigma(), thresholds.criticalSigma(),
                    config.getBaseline().getFullConfidenceSamples());
            case SEASONAL -> new SeasonalScorer(new SeasonalLookup(config.getBaseline()), calendar,
                    thresholds.warningSigma(), thresholds.criticalSigma());
            default -> throw new IllegalArgumentException(
                    "Not a metric scoring method: '" + method.label() + "'. Supported: zscore, seasonal");
        };
    }

    /**
     * Create the scorer set of one series.
     *
     * @param window existing trailing window to resume from, or {@code null} for an empty one
     */
    public static SeriesAnomalyScorer forSeries(String service, String metric, AnalyticsConfig config,
            HolidayCalendar calendar, TrailingWindow window) {
        DetectionSettings detection = config.getDetection();
        DetectionThresholds thresholds = detection.thresholdsFor(service, metric);
        TrailingWindow w = window != null ? window : new TrailingWindow(detection.getWindowCapacity());

        RollingZScoreScorer zScore = null;
        SeasonalScorer seasonal = null;
        switch (thresholds.mode()) {
            case ZSCORE -> zScore = (RollingZScoreScorer) create(DetectionMethod.ZSCORE, thresholds, config, calendar, w);
            case SEASONAL -> seasonal = (SeasonalScorer) create(DetectionMethod.SEASONAL, thresholds, config, calendar, w);
            case COMBINED -> {
                zScore = (RollingZScoreScorer) create(DetectionMethod.ZSCORE, thresholds, config, calendar, w);
                seasonal = (SeasonalScorer) create(DetectionMethod.SEASONAL, thresholds, config, calendar, w);
            }
        }
        return new SeriesAnomalyScorer(thresholds.mode(), zScore, seasonal);
    }
}
