package com.pulsewatch.core.logs;

import com.pulsewatch.core.config.LogMiningSettings;
import com.pulsewatch.core.config.ServiceMiningOverride;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.LogSeverity;
import com.pulsewatch.core.model.LogTemplate;
import com.pulsewatch.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LogTemplateMiner}.
 */
class LogTemplateMinerTest {

    private static final Instant T0 = Instant.parse("2026-04-01T09:00:00Z");

    private LogMiningSettings settings;
    private LogTemplateMiner miner;

    @BeforeEach
    void setUp() {
        settings = new LogMiningSettings();
        miner = new LogTemplateMiner(settings);
    }

    @Test
    @DisplayName("Should merge lines differing in one token into a wildcard template")
    void shouldMergeSimilarLines() {
        IngestResult first = miner.ingest("auth", T0, "INFO", "User 123 logged in");
        IngestResult second = miner.ingest("auth", T0.plusSeconds(1), "INFO", "User 456 logged in");

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.template().getId()).isEqualTo(first.template().getId());
        assertThat(second.template().getTemplate()).isEqualTo("User <*> logged in");
        assertThat(second.template().getTotalCount()).isEqualTo(2);
        assertThat(second.occurrence().getExtractedVariables()).containsExactly("456");
        assertThat(second.anomaly()).isEmpty();
        assertThat(miner.stats("auth").templateCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should create a new template and a new_pattern event for an unrelated line")
    void shouldFlagNewPattern() {
        miner.ingest("auth", T0, "INFO", "User 123 logged in");
        miner.ingest("auth", T0.plusSeconds(1), "INFO", "User 456 logged in");

        IngestResult disk = miner.ingest("auth", T0.plusSeconds(2), "WARN", "Disk full on node7");

        assertThat(disk.created()).isTrue();
        assertThat(disk.template().getTemplate()).isEqualTo("Disk full on node7");
        assertThat(disk.anomaly()).isPresent();
        AnomalyEvent event = disk.anomaly().get();
        assertThat(event.getMethod()).isEqualTo(DetectionMethod.NEW_PATTERN);
        assertThat(event.getMetricOrPattern()).isEqualTo(disk.template().getId());
        assertThat(event.getScore()).isEqualTo(0.6);
        assertThat(event.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(miner.stats("auth").templateCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should score a new error-looking pattern higher")
    void shouldScoreNewErrorPattern() {
        IngestResult result = miner.ingest("db", T0, "ERROR", "Connection refused by db-1");

        assertThat(result.template().isErrorPattern()).isTrue();
        assertThat(result.anomaly()).get().satisfies(e -> {
            assertThat(e.getScore()).isEqualTo(0.8);
            assertThat(e.getSeverity()).isEqualTo(Severity.WARNING);
        });
    }

    @Test
    @DisplayName("Should produce identical templates when replaying the same stream")
    void shouldBeIdempotentAcrossReplays() {
        List<LogRecord> stream = syntheticStream(500);

        LogTemplateMiner first = new LogTemplateMiner(settings);
        LogTemplateMiner second = new LogTemplateMiner(settings);
        stream.forEach(first::ingest);
        stream.forEach(second::ingest);

        List<LogTemplate> a = first.exportTemplates("api");
        List<LogTemplate> b = second.exportTemplates("api");
        assertThat(a).hasSameSizeAs(b);
        for (int i = 0; i < a.size(); i++) {
            assertThat(b.get(i).getId()).isEqualTo(a.get(i).getId());
            assertThat(b.get(i).getTemplate()).isEqualTo(a.get(i).getTemplate());
            assertThat(b.get(i).getTotalCount()).isEqualTo(a.get(i).getTotalCount());
            assertThat(b.get(i).getSeverityCounts()).isEqualTo(a.get(i).getSeverityCounts());
        }
        assertThat(first.stats("api")).isEqualTo(second.stats("api"));
    }

    @Test
    @DisplayName("Should keep template ids stable while positions generalize")
    void shouldKeepIdStable() {
        String id = miner.ingest("api", T0, "INFO", "GET /orders returned 200 in 12ms").template().getId();
        miner.ingest("api", T0.plusSeconds(1), "INFO", "GET /orders returned 500 in 40ms");

        LogTemplate template = miner.exportTemplates("api").get(0);
        List<String> creationTokens = List.of("GET", "/orders", "returned", "200", "in", "12ms");
        assertThat(template.getId()).isEqualTo(id).hasSize(16);
        assertThat(template.getTemplate()).isEqualTo("GET /orders returned <*> in <*>");
        assertThat(TemplateIds.of("api", creationTokens)).isEqualTo(id);
        assertThat(TemplateIds.of("web", creationTokens)).isNotEqualTo(id);
    }

    @Test
    @DisplayName("Should evict the least recently seen template at the cap")
    void shouldEvictAtCap() {
        settings.setTemplateCap(2);
        LogTemplateMiner capped = new LogTemplateMiner(settings);
        String oldest = capped.ingest("api", T0, "INFO", "alpha").template().getId();
        capped.ingest("api", T0.plusSeconds(1), "INFO", "beta gamma");
        capped.ingest("api", T0.plusSeconds(2), "INFO", "beta gamma");

        IngestResult third = capped.ingest("api", T0.plusSeconds(3), "INFO", "delta epsilon zeta");

        assertThat(third.evicted()).isNotNull();
        assertThat(third.evicted().getId()).isEqualTo(oldest);
        assertThat(capped.stats("api").templateCount()).isEqualTo(2);
        assertThat(capped.stats("api").evictions()).isEqualTo(1);
        assertThat(capped.totalEvictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should apply per-service merge thresholds")
    void shouldUseServiceThreshold() {
        settings.setMergeThreshold(0.9);
        ServiceMiningOverride lenient = new ServiceMiningOverride();
        lenient.setService("web");
        lenient.setMergeThreshold(0.6);
        settings.setServices(List.of(lenient));
        LogTemplateMiner strict = new LogTemplateMiner(settings);

        strict.ingest("auth", T0, "INFO", "User 123 logged in");
        IngestResult auth = strict.ingest("auth", T0.plusSeconds(1), "INFO", "User 456 logged in");
        strict.ingest("web", T0, "INFO", "User 123 logged in");
        IngestResult web = strict.ingest("web", T0.plusSeconds(1), "INFO", "User 456 logged in");

        assertThat(auth.created()).isTrue();
        assertThat(strict.stats("auth").templateCount()).isEqualTo(2);
        assertThat(web.created()).isFalse();
        assertThat(strict.stats("web").templateCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a frequency spike once per minute")
    void shouldDetectFrequencySpike() {
        for (int m = 0; m < 20; m++) {
            miner.ingest("cache", T0.plus(Duration.ofMinutes(m)), "INFO", "Cache refreshed");
        }

        List<AnomalyEvent> spikes = new ArrayList<>();
        int firstSpikeLine = -1;
        Instant burst = T0.plus(Duration.ofMinutes(20));
        for (int i = 0; i < 10; i++) {
            IngestResult r = miner.ingest("cache", burst.plusSeconds(i), "INFO", "Cache refreshed");
            if (r.anomaly().isPresent() && r.anomaly().get().getMethod() == DetectionMethod.FREQUENCY_SPIKE) {
                spikes.add(r.anomaly().get());
                if (firstSpikeLine < 0) {
                    firstSpikeLine = i;
                }
            }
        }

        assertThat(spikes).hasSize(1);
        // history is one line per minute with a std floor of 1; the sixth line is 5 sigma out
        assertThat(firstSpikeLine).isEqualTo(5);
        assertThat(spikes.get(0).getObserved()).isEqualTo(6.0);
        assertThat(spikes.get(0).getExpected()).isEqualTo(1.0);
        assertThat(spikes.get(0).getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("Should report an inter-arrival change as a pattern transition")
    void shouldDetectPatternTransition() {
        for (int m = 0; m < 15; m++) {
            miner.ingest("batch", T0.plus(Duration.ofMinutes(m)), "INFO", "Batch job finished");
        }

        IngestResult quick = miner.ingest("batch", T0.plus(Duration.ofMinutes(14)).plusSeconds(2), "INFO",
                "Batch job finished");

        assertThat(quick.anomaly()).isPresent();
        assertThat(quick.anomaly().get().getMethod()).isEqualTo(DetectionMethod.PATTERN_TRANSITION);
        assertThat(quick.anomaly().get().getSeverity()).isEqualTo(Severity.INFO);
        assertThat(quick.anomaly().get().getDeviationSigma()).isNegative();
    }

    @Test
    @DisplayName("Should report a minute far below the usual rate as a frequency drop")
    void shouldDetectFrequencyDrop() {
        for (int m = 0; m < 12; m++) {
            for (int i = 0; i < 10; i++) {
                miner.ingest("web", T0.plus(Duration.ofMinutes(m)).plusSeconds(i * 5L), "INFO", "Request served");
                miner.ingest("jobs", T0.plus(Duration.ofMinutes(m)).plusSeconds(i * 5L), "INFO", "Job polled");
            }
        }
        IngestResult lone = miner.ingest("web", T0.plus(Duration.ofMinutes(12)), "INFO", "Request served");

        IngestResult afterQuietMinute = miner.ingest("web", T0.plus(Duration.ofMinutes(13)), "INFO",
                "Request served");
        IngestResult afterSilence = miner.ingest("jobs", T0.plus(Duration.ofMinutes(15)), "INFO", "Job polled");

        assertThat(lone.anomaly()).isEmpty();
        assertThat(afterQuietMinute.anomaly()).isPresent();
        AnomalyEvent drop = afterQuietMinute.anomaly().get();
        assertThat(drop.getMethod()).isEqualTo(DetectionMethod.FREQUENCY_DROP);
        assertThat(drop.getObserved()).isEqualTo(1.0);
        assertThat(drop.getExpected()).isEqualTo(10.0);
        // history std is 0, floored to 1
        assertThat(drop.getDeviationSigma()).isEqualTo(-9.0);
        assertThat(drop.getSeverity()).isEqualTo(Severity.WARNING);

        assertThat(afterSilence.anomaly()).isPresent();
        assertThat(afterSilence.anomaly().get().getMethod()).isEqualTo(DetectionMethod.FREQUENCY_DROP);
        assertThat(afterSilence.anomaly().get().getObserved()).isZero();
    }

    @Test
    @DisplayName("Should not report drops for templates with a low usual rate")
    void shouldIgnoreDropOfQuietTemplate() {
        for (int m = 0; m < 12; m++) {
            miner.ingest("cron", T0.plus(Duration.ofMinutes(m)), "INFO", "Tick handled");
            miner.ingest("cron", T0.plus(Duration.ofMinutes(m)).plusSeconds(30), "INFO", "Tick handled");
        }

        IngestResult late = miner.ingest("cron", T0.plus(Duration.ofMinutes(14)), "INFO", "Tick handled");

        // the long gap still shows up, the drop does not
        assertThat(late.anomaly()).hasValueSatisfying(
                e -> assertThat(e.getMethod()).isEqualTo(DetectionMethod.PATTERN_TRANSITION));
    }

    @Test
    @DisplayName("Should report an improbable template transition within a session")
    void shouldDetectUnexpectedTransition() {
        IngestResult cancelled = miner.ingest("orders", T0.minusSeconds(10), "INFO", "Order cancelled by user", null);
        IngestResult paid = null;
        for (int k = 0; k < 12; k++) {
            Instant start = T0.plusSeconds(k * 2L);
            miner.ingest("orders", start, "INFO", "Order created", "session-" + k);
            paid = miner.ingest("orders", start.plusSeconds(1), "INFO", "Payment accepted", "session-" + k);
        }
        IngestResult created = miner.ingest("orders", T0.plusSeconds(24), "INFO", "Order created", "session-12");

        IngestResult odd = miner.ingest("orders", T0.plusSeconds(25), "INFO", "Order cancelled by user",
                "session-12");
        IngestResult unrelated = miner.ingest("orders", T0.plusSeconds(25), "INFO", "Payment accepted",
                "session-13");

        assertThat(odd.created()).isFalse();
        assertThat(odd.anomaly()).isPresent();
        AnomalyEvent event = odd.anomaly().get();
        assertThat(event.getMethod()).isEqualTo(DetectionMethod.UNEXPECTED_TRANSITION);
        assertThat(event.getMetricOrPattern()).isEqualTo(cancelled.template().getId());
        assertThat(event.getObserved()).isZero();
        assertThat(event.getScore()).isEqualTo(0.9);
        assertThat(event.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(event.getDetails())
                .contains(created.template().getId() + " -> " + cancelled.template().getId())
                .contains("usually -> " + paid.template().getId());
        assertThat(unrelated.anomaly()).isEmpty();
        assertThat(odd.occurrence().getSessionId()).isEqualTo("session-12");
    }

    @Test
    @DisplayName("Should not judge transitions before enough history or without a session")
    void shouldIgnoreTransitionsWithoutHistoryOrSession() {
        miner.ingest("orders", T0.minusSeconds(10), "INFO", "Order cancelled by user", null);
        for (int k = 0; k < 5; k++) {
            Instant start = T0.plusSeconds(k * 2L);
            miner.ingest("orders", start, "INFO", "Order created", "session-" + k);
            miner.ingest("orders", start.plusSeconds(1), "INFO", "Payment accepted", "session-" + k);
        }
        miner.ingest("orders", T0.plusSeconds(10), "INFO", "Order created", "session-5");

        IngestResult early = miner.ingest("orders", T0.plusSeconds(11), "INFO", "Order cancelled by user",
                "session-5");
        IngestResult sessionless = miner.ingest("orders", T0.plusSeconds(12), "INFO", "Order created", null);

        assertThat(early.anomaly()).isEmpty();
        assertThat(sessionless.anomaly()).isEmpty();
    }

    @Test
    @DisplayName("Should answer top, rare and recent template queries")
    void shouldAnswerQueries() {
        for (int i = 0; i < 10; i++) {
            miner.ingest("api", T0.plusSeconds(i), "INFO", "heartbeat ok");
        }
        miner.ingest("api", T0.plusSeconds(20), "FATAL", "kernel panic on host-3");

        List<LogTemplate> top = miner.topTemplates("api", 1);
        assertThat(top).extracting(LogTemplate::getTemplate).containsExactly("heartbeat ok");
        assertThat(miner.rareTemplates("api")).extracting(LogTemplate::getTemplate)
                .containsExactly("kernel panic on host-3");
        assertThat(miner.templatesSince("api", T0.plusSeconds(15))).hasSize(1);
        assertThat(miner.stats("api").errorTemplates()).isEqualTo(1);
        assertThat(miner.stats("api").compressionRatio()).isEqualTo(5.5);
        assertThat(miner.stats("unknown").totalLines()).isZero();
    }

    @Test
    @DisplayName("Should warm-start a service from exported templates")
    void shouldImportExportedTemplates() {
        miner.ingest("auth", T0, "INFO", "User 123 logged in");
        miner.ingest("auth", T0.plusSeconds(1), "ERROR", "User 456 logged in");
        List<LogTemplate> exported = miner.exportTemplates("auth");

        LogTemplateMiner restarted = new LogTemplateMiner(settings);
        restarted.importTemplates("auth", exported);
        IngestResult next = restarted.ingest("auth", T0.plusSeconds(2), "INFO", "User 789 logged in");

        assertThat(next.created()).isFalse();
        assertThat(next.anomaly()).isEmpty();
        assertThat(next.template().getId()).isEqualTo(exported.get(0).getId());
        assertThat(next.template().getTotalCount()).isEqualTo(3);
        assertThat(next.template().getSeverityCount(LogSeverity.ERROR)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should mask variables before tokenizing when enabled")
    void shouldMaskWhenEnabled() {
        settings.setMaskVariables(true);
        LogTemplateMiner masking = new LogTemplateMiner(settings);

        masking.ingest("edge", T0, "INFO", "Request from 10.0.0.1 took 35 ms");
        IngestResult second = masking.ingest("edge", T0.plusSeconds(1), "INFO", "Request from 10.0.0.2 took 41 ms");

        assertThat(second.created()).isFalse();
        assertThat(second.template().getTemplate()).isEqualTo("Request from <IP> took <NUM> ms");
        assertThat(second.template().getSampleLines()).contains("Request from 10.0.0.2 took 41 ms");
    }

    private static List<LogRecord> syntheticStream(int size) {
        Random random = new Random(11);
        String[] severities = {"INFO", "INFO", "WARN", "ERROR"};
        List<LogRecord> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Instant ts = T0.plusSeconds(i * 7L);
            String severity = severities[random.nextInt(severities.length)];
            String body = switch (random.nextInt(4)) {
                case 0 -> "User " + random.nextInt(1000) + " logged in";
                case 1 -> "GET /items/" + random.nextInt(50) + " returned " + (200 + random.nextInt(3) * 100);
                case 2 -> "Payment " + random.nextInt(100000) + " failed: card declined";
                default -> "Worker " + random.nextInt(8) + " heartbeat";
            };
            records.add(new LogRecord("api", ts, severity, body));
        }
        return records;
    }
}
