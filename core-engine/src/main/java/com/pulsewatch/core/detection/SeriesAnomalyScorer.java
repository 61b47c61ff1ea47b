package com.pulsewatch.core.detection;

import com.pulsewatch.core.config.ScoringMode;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * The scorers configured for one series, combined according to its
 * {@link ScoringMode}.
 *
 * <p>
 * In {@link ScoringMode#COMBINED} mode both scorers run on every sample (so
 * the trailing window keeps filling). When both fire, the seasonal event is
 * kept if its confidence is at least the z-score event's.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesAnomalyScorer implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ScoringMode mode;
    private final RollingZScoreScorer zScore;
    private final SeasonalScorer seasonal;

    SeriesAnomalyScorer(ScoringMode mode, RollingZScoreScorer zScore, SeasonalScorer seasonal) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (mode != ScoringMode.SEASONAL) {
            Objects.requireNonNull(zScore, "z-score scorer required for mode " + mode);
        }
        if (mode != ScoringMode.ZSCORE) {
            Objects.requireNonNull(seasonal, "seasonal scorer required for mode " + mode);
        }
        this.zScore = zScore;
        this.seasonal = seasonal;
    }

    /**
     * @param sample   the observation
     * @param baseline the series' current baseline, {@code null} if none
     * @return the winning event, if any scorer fired
     */
    public Optional<AnomalyEvent> score(MetricSample sample, SeasonalBaseline baseline) {
        return switch (mode) {
            case ZSCORE -> zScore.score(sample, baseline);
            case SEASONAL -> seasonal.score(sample, baseline);
            case COMBINED -> pick(zScore.score(sample, baseline), seasonal.score(sample, baseline));
        };
    }

    static Optional<AnomalyEvent> pick(Optional<AnomalyEvent> zEvent, Optional<AnomalyEvent> seasonalEvent) {
        if (zEvent.isEmpty()) {
            return seasonalEvent;
        }
        if (seasonalEvent.isEmpty()) {
            return zEvent;
        }
        return seasonalEvent.get().getConfidence() >= zEvent.get().getConfidence() ? seasonalEvent : zEvent;
    }

    public ScoringMode mode() {
        return mode;
    }

    /**
     * @return the trailing window, or {@code null} in seasonal-only mode
     */
    public TrailingWindow window() {
        return zScore != null ? zScore.window() : null;
    }
}
