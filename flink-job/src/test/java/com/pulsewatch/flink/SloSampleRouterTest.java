package com.pulsewatch.flink;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SloDefinition;
import org.apache.flink.api.common.functions.util.ListCollector;
import org.apache.flink.configuration.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SloSampleRouter} and the tick arithmetic of
 * {@link SloEvaluationProcessFunction}.
 */
class SloSampleRouterTest {

    private static final Instant T0 = Instant.parse("2026-05-04T10:00:30Z");

    private AnalyticsConfig config;

    @BeforeEach
    void setUp() {
        config = new AnalyticsConfig();
        config.setSlos(List.of(
                new SloDefinition("availability", "checkout", "http_status", "availability", 500, "lt", 99.9, 30),
                new SloDefinition("errors", "checkout", "http_status", "error_rate", 400, "lt", 99.0, 7),
                new SloDefinition("latency", "checkout", "latency_ms", "latency", 300, "lte", 99.0, 7),
                new SloDefinition("broken", "checkout", "http_status", "availability", 500, "lt", 100.0, 30)));
    }

    @Test
    @DisplayName("Should classify a sample against every valid SLO of its series")
    void shouldRouteSample() {
        SloSampleRouter router = new SloSampleRouter(config);
        router.open(new Configuration());
        List<SloCountTick> out = new ArrayList<>();

        router.flatMap(new MetricSample("checkout", "http_status", T0, 404), new ListCollector<>(out));

        assertThat(out).containsExactlyInAnyOrder(
                new SloCountTick("availability", T0, 1, 0),
                new SloCountTick("errors", T0, 0, 1));
    }

    @Test
    @DisplayName("Should emit nothing for series without SLOs or non-finite values")
    void shouldIgnoreUnrelatedSamples() {
        SloSampleRouter router = new SloSampleRouter(config);
        router.open(new Configuration());
        List<SloCountTick> out = new ArrayList<>();

        router.flatMap(new MetricSample("payments", "http_status", T0, 200), new ListCollector<>(out));
        router.flatMap(new MetricSample("checkout", "latency_ms", T0, Double.NaN), new ListCollector<>(out));

        assertThat(out).isEmpty();
    }

    @Test
    @DisplayName("Should end a tick at the next multiple of the tick length")
    void shouldComputeTickBoundary() {
        SloEvaluationProcessFunction function = new SloEvaluationProcessFunction(config);

        assertThat(function.tickBoundary(T0.toEpochMilli()))
                .isEqualTo(Instant.parse("2026-05-04T10:01:00Z").toEpochMilli());
        assertThat(function.tickBoundary(Instant.parse("2026-05-04T10:01:00Z").toEpochMilli()))
                .isEqualTo(Instant.parse("2026-05-04T10:02:00Z").toEpochMilli());
    }

    @Test
    @DisplayName("Should book a tick's counts at the start of the tick it closes")
    void shouldEvaluateTickAtItsStart() {
        SloEvaluationProcessFunction function = new SloEvaluationProcessFunction(config);
        long boundary = function.tickBoundary(T0.toEpochMilli());

        Instant start = function.tickStart(boundary);

        assertThat(start).isEqualTo(Instant.parse("2026-05-04T10:00:00Z"));
        assertThat(function.tickBoundary(start.toEpochMilli())).isEqualTo(boundary);
    }
}
