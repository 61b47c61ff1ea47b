package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.BaselineRegistry;
import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeriesKey;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Scores metric samples against the trailing window and the latest published
 * baseline of their series.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Samples of one series must be submitted by a single owner at a time; the
 * per-series scorer is not synchronized. Different series may be scored in
 * parallel. The baseline is read from the {@link BaselineRegistry} on every
 * call, so a concurrent recompute is picked up on the next sample and a
 * partially built baseline is never seen.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private final AnalyticsConfig config;
    private final BaselineRegistry baselines;
    private final HolidayCalendar calendar;
    private final ConcurrentMap<SeriesKey, SeriesAnomalyScorer> scorers = new ConcurrentHashMap<>();

    public AnomalyDetector(AnalyticsConfig config, BaselineRegistry baselines, HolidayCalendar calendar) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.calendar = calendar != null ? calendar : HolidayCalendar.none();
    }

    /**
     * Score one observation.
     *
     * @return an event when the observation deviates beyond the warning cutoff
     */
    public Optional<AnomalyEvent> score(String service, String metric, double observedValue, Instant timestamp) {
        return score(new MetricSample(service, metric, timestamp, observedValue));
    }

    public Optional<AnomalyEvent> score(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        SeriesKey key = sample.seriesKey();
        SeriesAnomalyScorer scorer = scorers.computeIfAbsent(key,
                k -> ScorerFactory.forSeries(k.service(), k.metricName(), config, calendar, null));
        SeasonalBaseline baseline = baselines.current(key).orElse(null);
        return scorer.score(sample, baseline);
    }

    /**
     * @return number of series with scoring state
     */
    public int trackedSeries() {
        return scorers.size();
    }
}
