package com.pulsewatch.core.logs;

import com.pulsewatch.core.config.LogMiningSettings;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogPatternOccurrence;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.LogSeverity;
import com.pulsewatch.core.model.LogTemplate;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Incremental, per-service log template clustering with a pattern anomaly
 * sub-detector.
 *
 * <p>
 * Each service owns an independent {@link ServiceTemplateSet}. Template ids
 * are content hashes, so identical input streams produce identical template
 * ids, counts and severity histograms in any process.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Lines of one service must be ingested by a single owner at a time. Lines of
 * different services may be ingested in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class LogTemplateMiner {

    private final LogMiningSettings settings;
    private final ConcurrentMap<String, ServiceTemplateSet> services = new ConcurrentHashMap<>();

    public LogTemplateMiner(LogMiningSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    public IngestResult ingest(String service, Instant timestamp, String severity, String body) {
        return ingest(service, timestamp, severity, body, null);
    }

    public IngestResult ingest(LogRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return ingest(record.getService(), record.getTimestamp(), record.getSeverity(), record.getBody(),
                record.getSessionId());
    }

    /**
     * Cluster one line.
     *
     * @param service   owning service
     * @param timestamp line timestamp
     * @param severity  free-form severity text, may be {@code null}
     * @param body      raw line body
     * @param sessionId session the line belongs to, may be {@code null}
     * @return the matched template, the occurrence and any pattern anomaly
     */
    public IngestResult ingest(String service, Instant timestamp, String severity, String body, String sessionId) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        ServiceTemplateSet set = services.computeIfAbsent(service,
                s -> ServiceTemplateSet.forService(s, settings));
        return ingest(set, timestamp, LogSeverity.parse(severity), body, sessionId, settings);
    }

    /**
     * Cluster one line into an explicitly owned template set. Used by
     * deployments that keep the set in their own keyed state.
     */
    public static IngestResult ingest(ServiceTemplateSet set, Instant timestamp, LogSeverity severity,
            String body, String sessionId, LogMiningSettings settings) {
        String text = body != null ? body : "";
        String prepared = settings.isMaskVariables() ? VariableMasker.mask(text) : text;
        List<String> tokens = LogTokenizer.tokenize(prepared);

        ServiceTemplateSet.Placement placement = set.place(tokens, timestamp, severity, text, sessionId, settings);
        Optional<AnomalyEvent> anomaly = PatternAnomalyDetector.evaluate(placement, timestamp, settings);
        LogTemplate template = placement.template();
        LogPatternOccurrence occurrence = new LogPatternOccurrence(template.getId(), set.service(), timestamp,
                sessionId, placement.extractedVariables());
        return new IngestResult(template.copy(), occurrence, anomaly, placement.created(), placement.evicted());
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public MinerStats stats(String service) {
        ServiceTemplateSet set = services.get(service);
        if (set == null) {
            return new MinerStats(service, 0, 0, 0, 0.0, 0, 0);
        }
        return stats(set);
    }

    public static MinerStats stats(ServiceTemplateSet set) {
        long errors = set.templates().stream().filter(LogTemplate::isErrorPattern).count();
        long rare = set.templates().stream().filter(LogTemplate::isRarePattern).count();
        double ratio = set.size() == 0 ? 0.0 : (double) set.totalLines() / set.size();
        return new MinerStats(set.service(), set.totalLines(), set.size(), set.evictions(), ratio, errors, rare);
    }

    /**
     * @return copies of the {@code n} most frequent templates, most frequent first
     */
    public List<LogTemplate> topTemplates(String service, int n) {
        return copies(service, Comparator.comparingLong(LogTemplate::getTotalCount).reversed(), n);
    }

    public List<LogTemplate> rareTemplates(String service) {
        ServiceTemplateSet set = services.get(service);
        if (set == null) {
            return List.of();
        }
        return set.templates().stream()
                .filter(LogTemplate::isRarePattern)
                .map(LogTemplate::copy)
                .toList();
    }

    public List<LogTemplate> templatesSince(String service, Instant since) {
        ServiceTemplateSet set = services.get(service);
        if (set == null) {
            return List.of();
        }
        return set.templates().stream()
                .filter(t -> t.getFirstSeen() != null && !t.getFirstSeen().isBefore(since))
                .map(LogTemplate::copy)
                .toList();
    }

    private List<LogTemplate> copies(String service, Comparator<LogTemplate> order, int limit) {
        ServiceTemplateSet set = services.get(service);
        if (set == null) {
            return List.of();
        }
        return set.templates().stream()
                .sorted(order.thenComparing(LogTemplate::getId))
                .limit(limit)
                .map(LogTemplate::copy)
                .toList();
    }

    // ---------------------------------------------------------------
    // Export / import
    // ---------------------------------------------------------------

    /**
     * @return copies of every template of the service
     */
    public List<LogTemplate> exportTemplates(String service) {
        ServiceTemplateSet set = services.get(service);
        if (set == null) {
            return List.of();
        }
        return set.templates().stream().map(LogTemplate::copy).toList();
    }

    /**
     * Warm-start a service from exported templates.
     */
    public void importTemplates(String service, List<LogTemplate> templates) {
        Objects.requireNonNull(templates, "templates must not be null");
        ServiceTemplateSet set = services.computeIfAbsent(service,
                s -> ServiceTemplateSet.forService(s, settings));
        for (LogTemplate t : templates) {
            set.restore(t, settings);
        }
    }

    public long totalEvictions() {
        return services.values().stream().mapToLong(ServiceTemplateSet::evictions).sum();
    }

    public LogMiningSettings settings() {
        return settings;
    }
}
