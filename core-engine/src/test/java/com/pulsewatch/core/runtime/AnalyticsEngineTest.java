package com.pulsewatch.core.runtime;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.logs.IngestResult;
import com.pulsewatch.core.model.AlertStatus;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeriesKey;
import com.pulsewatch.core.model.Severity;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloStatus;
import com.pulsewatch.core.slo.SloEvaluation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalyticsEngine}.
 */
class AnalyticsEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-07T13:00:00Z");
    private static final String SLO = "checkout-availability";

    private InMemoryMetricStore store;
    private CollectingSink sink;
    private AnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = new AnalyticsConfig();
        config.getRuntime().setWorkers(2);
        config.getRuntime().setQueueCapacity(1_000);
        config.getRuntime().setStorageTimeoutMillis(500);
        config.getRuntime().setRetryAttempts(2);
        config.getRuntime().setRetryBackoffMillis(1);
        config.getRuntime().setRetryBackoffCapMillis(5);
        config.setSlos(List.of(
                new SloDefinition(SLO, "checkout", "http_status", "availability", 500, "lt", 99.9, 30)));

        store = new InMemoryMetricStore();
        sink = new CollectingSink();
        engine = new AnalyticsEngine(config, store, sink, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should store samples and emit an anomaly for an outlier")
    void shouldScoreSamples() {
        warmUp();

        Optional<AnomalyEvent> event = engine.processSample(
                new MetricSample("checkout", "latency_ms", T0.plus(Duration.ofMinutes(55)), 160));

        assertThat(event).isPresent();
        assertThat(event.get().getMethod()).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(event.get().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(sink.anomalies).containsExactly(event.get());
        assertThat(engine.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(store.samples).hasSize(51);
        assertThat(engine.samplesProcessed()).isEqualTo(51);
        assertThat(engine.anomaliesEmitted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should score submitted samples on the worker pool in order")
    void shouldScoreSubmittedSamples() {
        for (int i = 0; i < 50; i++) {
            engine.submitSample(new MetricSample("checkout", "latency_ms", T0.plus(Duration.ofMinutes(i)),
                    i % 2 == 0 ? 90 : 110));
        }
        engine.submitSample(new MetricSample("checkout", "latency_ms", T0.plus(Duration.ofMinutes(55)), 160));

        assertThat(engine.awaitIdle(Duration.ofSeconds(10))).isTrue();
        assertThat(engine.samplesProcessed()).isEqualTo(51);
        assertThat(sink.anomalies).singleElement()
                .satisfies(e -> assertThat(e.getObserved()).isEqualTo(160.0));
        assertThat(engine.droppedTasks()).isZero();
    }

    @Test
    @DisplayName("Should keep scoring when the store is down")
    void shouldScoreWithoutStore() {
        store.failing = true;

        engine.processSample(new MetricSample("checkout", "latency_ms", T0, 100));

        assertThat(engine.samplesProcessed()).isEqualTo(1);
        assertThat(store.samples).isEmpty();
    }

    @Test
    @DisplayName("Should mine log lines and forward templates, occurrences and new patterns")
    void shouldMineLogs() {
        IngestResult result = engine.processLog(new LogRecord("db", T0, "ERROR", "Connection refused by db-1"));

        assertThat(result.created()).isTrue();
        assertThat(engine.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(store.logs).hasSize(1);
        assertThat(sink.templates).singleElement()
                .satisfies(t -> assertThat(t.getId()).isEqualTo(result.template().getId()));
        assertThat(sink.occurrences).hasSize(1);
        assertThat(sink.anomalies).singleElement()
                .satisfies(e -> assertThat(e.getMethod()).isEqualTo(DetectionMethod.NEW_PATTERN));
        assertThat(engine.miner().stats("db").templateCount()).isEqualTo(1);
        assertThat(engine.logsProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should publish a recomputed baseline and keep it stale when history is unreadable")
    void shouldRecomputeBaseline() {
        for (int h = 0; h < 30; h++) {
            store.samples.add(new MetricSample("checkout", "latency_ms", T0.minus(Duration.ofHours(h + 1)), 100 + h));
        }
        SeriesKey key = new SeriesKey("checkout", "latency_ms");

        Optional<SeasonalBaseline> computed = engine.recomputeBaseline("checkout", "latency_ms", T0);

        assertThat(computed).isPresent();
        assertThat(computed.get().getSampleCount()).isEqualTo(30);
        assertThat(computed.get().isInsufficientHistory()).isTrue();
        assertThat(engine.baselines().current(key)).contains(computed.get());

        store.failing = true;
        Optional<SeasonalBaseline> failed = engine.recomputeBaseline("checkout", "latency_ms", T0.plusSeconds(60));

        assertThat(failed).isEmpty();
        assertThat(engine.failedRecomputes()).isEqualTo(1);
        assertThat(engine.staleBaselines()).isEqualTo(1);
        assertThat(engine.baselines().isStale(key)).isTrue();
        assertThat(engine.baselines().current(key)).contains(computed.get());
    }

    @Test
    @DisplayName("Should evaluate an SLO tick from the samples of the tick interval")
    void shouldTickSlo() {
        for (int i = 0; i < 10; i++) {
            store.samples.add(new MetricSample("checkout", "http_status", T0.minusSeconds(50 - i), i == 0 ? 503 : 200));
        }
        // outside the tick interval
        store.samples.add(new MetricSample("checkout", "http_status", T0.minusSeconds(120), 503));

        Optional<SloEvaluation> evaluation = engine.tickSlo(SLO, T0);

        assertThat(evaluation).isPresent();
        // booked at the start of the tick interval
        assertThat(evaluation.get().measurement().getTimestamp()).isEqualTo(T0.minusSeconds(60));
        assertThat(evaluation.get().measurement().getGoodCount()).isEqualTo(9);
        assertThat(evaluation.get().measurement().getBadCount()).isEqualTo(1);
        // 10% bad against a 0.1% budget
        assertThat(evaluation.get().status().getAlertStatus()).isEqualTo(AlertStatus.CRITICAL);
        assertThat(sink.measurements).hasSize(1);
        assertThat(sink.statuses).containsExactly(evaluation.get().status());
    }

    @Test
    @DisplayName("Should skip an SLO tick and republish the status stale when counts are unreadable")
    void shouldSkipTickWhenStoreFails() {
        store.samples.add(new MetricSample("checkout", "http_status", T0.minusSeconds(10), 200));
        engine.tickSlo(SLO, T0);
        store.failing = true;

        Optional<SloEvaluation> skipped = engine.tickSlo(SLO, T0.plusSeconds(60));

        assertThat(skipped).isEmpty();
        assertThat(engine.skippedTicks()).isEqualTo(1);
        SloStatus last = sink.statuses.get(sink.statuses.size() - 1);
        assertThat(last.isStale()).isTrue();
        assertThat(last.getAlertStatus()).isEqualTo(AlertStatus.OK);
        assertThat(engine.sloEvaluator().currentStatus(SLO)).contains(last);
    }

    @Test
    @DisplayName("Should score a service promptly while appends for another service hang")
    void shouldNotStallScoringOnSlowStore() throws InterruptedException {
        store.hangingService = "slow";
        try (AnalyticsEngine single = newEngine(store, 1, 2_000)) {
            single.submitSample(new MetricSample("slow", "latency_ms", T0, 100));
            single.submitSample(new MetricSample("fast", "latency_ms", T0, 100));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
            while (single.samplesProcessed() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertThat(single.samplesProcessed()).isEqualTo(2);
            assertThat(single.droppedTasks()).isZero();
        }
    }

    @Test
    @DisplayName("Should not fold the counts of an overtaken SLO tick into the SLO state")
    void shouldDiscardOvertakenTick() throws Exception {
        for (int i = 0; i < 10; i++) {
            store.samples.add(new MetricSample("checkout", "http_status", T0.minusSeconds(30 + i), 503));
            store.samples.add(new MetricSample("checkout", "http_status", T0.plusSeconds(30 + i), 200));
        }
        CountDownLatch queried = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryMetricStore gated = new InMemoryMetricStore() {
            @Override
            public List<MetricSample> querySamples(String service, String metricName, Instant from, Instant to) {
                if (to.equals(T0)) {
                    queried.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return store.querySamples(service, metricName, from, to);
            }
        };
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try (AnalyticsEngine gatedEngine = newEngine(gated, 2, 2_000)) {
            Future<Optional<SloEvaluation>> older = caller.submit(() -> gatedEngine.tickSlo(SLO, T0));
            assertThat(queried.await(5, TimeUnit.SECONDS)).isTrue();

            Optional<SloEvaluation> newer = gatedEngine.tickSlo(SLO, T0.plusSeconds(60));
            release.countDown();

            assertThat(newer).isPresent();
            assertThat(older.get(5, TimeUnit.SECONDS)).isEmpty();
            assertThat(gatedEngine.discardedTicks()).isEqualTo(1);
            SloStatus status = gatedEngine.sloEvaluator().currentStatus(SLO).orElseThrow();
            assertThat(status).isEqualTo(newer.get().status());
            assertThat(status.getCurrentAttainment()).isEqualTo(100.0);
            assertThat(status.getAlertStatus()).isEqualTo(AlertStatus.OK);
        } finally {
            caller.shutdownNow();
        }
    }

    private AnalyticsEngine newEngine(MetricStore metricStore, int workers, long storageTimeoutMillis) {
        AnalyticsConfig config = new AnalyticsConfig();
        config.getRuntime().setWorkers(workers);
        config.getRuntime().setStorageTimeoutMillis(storageTimeoutMillis);
        config.getRuntime().setRetryAttempts(2);
        config.getRuntime().setRetryBackoffMillis(1);
        config.getRuntime().setRetryBackoffCapMillis(5);
        config.setSlos(List.of(
                new SloDefinition(SLO, "checkout", "http_status", "availability", 500, "lt", 99.9, 30)));
        return new AnalyticsEngine(config, metricStore, new CollectingSink(), Clock.fixed(T0, ZoneOffset.UTC));
    }

    private void warmUp() {
        for (int i = 0; i < 50; i++) {
            engine.processSample(new MetricSample("checkout", "latency_ms", T0.plus(Duration.ofMinutes(i)),
                    i % 2 == 0 ? 90 : 110));
        }
    }
}
