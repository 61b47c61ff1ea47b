package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.BaselineLookup;
import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.baseline.SeasonalLookup;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Deviation from the seasonal baseline.
 *
 * <p>
 * {@code deviationSigma = (observed - expected) / expectedStd} with
 * {@code expected} and {@code expectedStd} read from the baseline at the
 * sample's timestamp. On holidays and weekends the cutoffs are multiplied by
 * the calendar's leniency factor.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalScorer implements MetricScorer {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SeasonalScorer.class);

    private final SeasonalLookup lookup;
    private final HolidayCalendar calendar;
    private final double warningSigma;
    private final double criticalSigma;

    public SeasonalScorer(SeasonalLookup lookup, HolidayCalendar calendar,
            double warningSigma, double criticalSigma) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        this.calendar = calendar != null ? calendar : HolidayCalendar.none();
        this.warningSigma = warningSigma;
        this.criticalSigma = criticalSigma;
    }

    @Override
    public Optional<AnomalyEvent> score(MetricSample sample, SeasonalBaseline baseline) {
        Objects.requireNonNull(sample, "sample must not be null");
        if (baseline == null || !Double.isFinite(sample.getValue())) {
            return Optional.empty();
        }

        BaselineLookup expected = lookup.lookup(baseline, sample.getTimestamp());
        double sigma = (sample.getValue() - expected.expected()) / expected.expectedStd();
        double leniency = calendar.leniency(sample.getTimestamp(), ZoneId.of(baseline.getZoneId()));
        Severity severity = Severity.fromSigma(Math.abs(sigma), warningSigma * leniency, criticalSigma * leniency);
        if (severity == null) {
            return Optional.empty();
        }

        String details = expected.describe();
        if (leniency > 1.0) {
            details += String.format(Locale.ROOT, "; %s leniency x%.1f",
                    calendar.dayKind(sample.getTimestamp(), ZoneId.of(baseline.getZoneId())), leniency);
        }
        LOG.debug("Seasonal deviation for {}: value={} expected={} std={} sigma={}",
                sample.seriesKey(), sample.getValue(), expected.expected(), expected.expectedStd(), sigma);

        return Optional.of(AnomalyEvent.builder()
                .service(sample.getService())
                .metricOrPattern(sample.getMetricName())
                .timestamp(sample.getTimestamp())
                .observed(sample.getValue())
                .expected(expected.expected())
                .expectedStd(expected.expectedStd())
                .deviationSigma(sigma)
                .score(Math.min(1.0, Math.abs(sigma) / RollingZScoreScorer.SCORE_SATURATION_SIGMA))
                .confidence(expected.confidence())
                .method(DetectionMethod.SEASONAL)
                .severity(severity)
                .details(details)
                .build());
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL;
    }
}
