package com.pulsewatch.core.detection;

import com.pulsewatch.core.baseline.BaselineRegistry;
import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.config.MetricPolicy;
import com.pulsewatch.core.config.ScoringMode;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyDetector} and {@link ScorerFactory}.
 */
class AnomalyDetectorTest {

    private static final Instant T0 = Instant.parse("2026-01-07T13:00:00Z");

    private AnalyticsConfig config;
    private BaselineRegistry registry;

    @BeforeEach
    void setUp() {
        config = new AnalyticsConfig();
        registry = new BaselineRegistry();
    }

    @Test
    @DisplayName("Should fall back to z-score in combined mode while no baseline exists")
    void shouldUseZScoreWithoutBaseline() {
        AnomalyDetector detector = new AnomalyDetector(config, registry, HolidayCalendar.none());
        warmUp(detector);

        Optional<AnomalyEvent> event = detector.score("checkout", "latency_ms", 160, T0.plus(Duration.ofMinutes(55)));

        assertThat(event).isPresent();
        assertThat(event.get().getMethod()).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(event.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(detector.trackedSeries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should prefer the seasonal event when it is at least as confident")
    void shouldPreferSeasonalInCombinedMode() {
        registry.publish(SeasonalScorerTest.hourlyBaseline());
        AnomalyDetector detector = new AnomalyDetector(config, registry, null);
        warmUp(detector);

        // 14:05, bucket 14 expects 120 +- 10; the window expects 100 +- 10
        Optional<AnomalyEvent> event = detector.score("checkout", "latency_ms", 175, T0.plus(Duration.ofMinutes(65)));

        assertThat(event).isPresent();
        assertThat(event.get().getMethod()).isEqualTo(DetectionMethod.SEASONAL);
        assertThat(event.get().getExpected()).isEqualTo(120.0);
    }

    @Test
    @DisplayName("Should honour a per-metric seasonal-only policy")
    void shouldHonourMetricPolicy() {
        MetricPolicy policy = new MetricPolicy();
        policy.setService("checkout");
        policy.setMetric("latency_ms");
        policy.setMode("seasonal");
        config.getDetection().setMetrics(List.of(policy));
        AnomalyDetector detector = new AnomalyDetector(config, registry, null);
        warmUp(detector);

        // no baseline yet and z-score disabled
        assertThat(detector.score("checkout", "latency_ms", 10_000, T0.plus(Duration.ofMinutes(55)))).isEmpty();
        assertThat(ScorerFactory.forSeries("checkout", "latency_ms", config, null, null).mode())
                .isEqualTo(ScoringMode.SEASONAL);
        assertThat(ScorerFactory.forSeries("checkout", "latency_ms", config, null, null).window()).isNull();
    }

    @Test
    @DisplayName("Should keep series independent")
    void shouldIsolateSeries() {
        AnomalyDetector detector = new AnomalyDetector(config, registry, null);
        warmUp(detector);

        assertThat(detector.score("checkout", "other_metric", 160, T0.plus(Duration.ofMinutes(55)))).isEmpty();
        assertThat(detector.trackedSeries()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject log-pattern methods in the scorer factory")
    void shouldRejectLogMethods() {
        assertThatThrownBy(() -> ScorerFactory.create(DetectionMethod.NEW_PATTERN,
                config.getDetection().thresholdsFor("a", "b"), config, null, new TrailingWindow(10)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a metric scoring method");
    }

    private static void warmUp(AnomalyDetector detector) {
        for (int i = 0; i < 50; i++) {
            detector.score("checkout", "latency_ms", i % 2 == 0 ? 90 : 110, T0.plus(Duration.ofMinutes(i)));
        }
    }
}
