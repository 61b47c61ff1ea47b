package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.baseline.SeasonalLookup;
import com.pulsewatch.core.config.BaselineSettings;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeasonalPeriod;
import com.pulsewatch.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.MonthDay;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalScorer}.
 */
class SeasonalScorerTest {

    /** Wednesday. */
    private static final Instant WEEKDAY_1400 = Instant.parse("2026-01-07T14:10:00Z");

    /** Saturday. */
    private static final Instant SATURDAY_1400 = Instant.parse("2026-01-10T14:10:00Z");

    private final SeasonalLookup lookup = new SeasonalLookup(new BaselineSettings());

    @Test
    @DisplayName("Should score against the hour-of-day bucket")
    void shouldScoreAgainstBucket() {
        SeasonalScorer scorer = new SeasonalScorer(lookup, HolidayCalendar.none(), 3.0, 4.0);

        Optional<AnomalyEvent> event = scorer.score(sample(WEEKDAY_1400, 170), hourlyBaseline());

        assertThat(event).isPresent();
        AnomalyEvent e = event.get();
        assertThat(e.getMethod()).isEqualTo(DetectionMethod.SEASONAL);
        assertThat(e.getExpected()).isEqualTo(120.0);
        assertThat(e.getDeviationSigma()).isCloseTo(5.0, within(1e-9));
        assertThat(e.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(e.getConfidence()).isEqualTo(1.0);
        assertThat(e.getDetails()).isEqualTo("Unusual for hour 14:00 (expected ~120.00)");
    }

    @Test
    @DisplayName("Should NOT fire within the warning cutoff")
    void shouldStayQuietWithinCutoff() {
        SeasonalScorer scorer = new SeasonalScorer(lookup, HolidayCalendar.none(), 3.0, 4.0);

        assertThat(scorer.score(sample(WEEKDAY_1400, 149), hourlyBaseline())).isEmpty();
        assertThat(scorer.score(sample(WEEKDAY_1400, 155), hourlyBaseline()))
                .get().extracting(AnomalyEvent::getSeverity).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Should widen thresholds on weekends and holidays")
    void shouldApplyLeniency() {
        HolidayCalendar calendar = new HolidayCalendar(List.of(MonthDay.of(1, 7)), List.of(), 2.0, 1.5);
        SeasonalScorer scorer = new SeasonalScorer(lookup, calendar, 3.0, 4.0);

        // 5 sigma: critical on a regular day, a warning at 1.5x, nothing at 2x
        assertThat(scorer.score(sample(WEEKDAY_1400, 170), hourlyBaseline())).isEmpty();
        Optional<AnomalyEvent> weekend = scorer.score(sample(SATURDAY_1400, 170), hourlyBaseline());
        assertThat(weekend).isPresent();
        assertThat(weekend.get().getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(weekend.get().getDetails()).contains("weekend leniency x1.5");
    }

    @Test
    @DisplayName("Should NOT score without a baseline")
    void shouldSkipWithoutBaseline() {
        SeasonalScorer scorer = new SeasonalScorer(lookup, null, 3.0, 4.0);

        assertThat(scorer.score(sample(WEEKDAY_1400, 1_000), null)).isEmpty();
    }

    static MetricSample sample(Instant ts, double value) {
        return new MetricSample("checkout", "latency_ms", ts, value);
    }

    /**
     * Hourly baseline: 120 +- 10 at 14:00, 100 +- 10 elsewhere.
     */
    static SeasonalBaseline hourlyBaseline() {
        double[] means = new double[24];
        double[] stds = new double[24];
        long[] counts = new long[24];
        Arrays.fill(means, 100.0);
        Arrays.fill(stds, 10.0);
        Arrays.fill(counts, 50);
        means[14] = 120.0;
        return SeasonalBaseline.builder("checkout", "latency_ms")
                .buckets(SeasonalPeriod.HOURLY, means, stds, counts)
                .pattern(SeasonalPeriod.HOURLY, 0.8, true)
                .global(101.0, 12.0)
                .sampleCount(1200)
                .dominantPeriod(SeasonalPeriod.HOURLY)
                .validity(Instant.parse("2026-01-05T00:00:00Z"), Instant.parse("2026-02-05T00:00:00Z"))
                .build();
    }
}
