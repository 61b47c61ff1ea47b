package com.pulsewatch.core.logs;

import com.pulsewatch.core.config.LogMiningSettings;
import com.pulsewatch.core.model.LogSeverity;
import com.pulsewatch.core.model.LogTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The templates of one service, indexed by token count.
 *
 * <h3>Matching</h3>
 * <p>
 * A line is compared only with templates of the same token count.
 * Similarity is the fraction of the template's literal positions whose
 * token equals the line's; a template made only of wildcards has similarity
 * 1. The most similar candidate wins, the earliest created one on ties. At
 * or above the merge threshold the line merges and every differing literal
 * position becomes a wildcard; otherwise a new template is created.
 * </p>
 *
 * <h3>Sessions</h3>
 * <p>
 * Lines carrying a session id feed a {@link SessionTransitions} that flags
 * improbable template-to-template transitions within a session.
 * </p>
 *
 * <h3>Capacity</h3>
 * <p>
 * When the set holds {@code templateCap} templates, creating another first
 * evicts the least recently seen one.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Lines of one service must be ingested sequentially.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceTemplateSet implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ServiceTemplateSet.class);

    static final List<String> ERROR_KEYWORDS = List.of(
            "error", "exception", "fail", "fatal", "critical",
            "panic", "crash", "abort", "timeout", "refused",
            "denied", "unauthorized", "forbidden", "invalid");

    /** Outcome of placing one line. */
    public record Placement(LogTemplate template, boolean created, List<String> extractedVariables,
            LogTemplate evicted, TemplateActivity.Deviation rateSpike, TemplateActivity.Deviation rateDrop,
            SessionTransitions.Transition transition, TemplateActivity.Deviation gapDeviation) {
    }

    private final String service;
    private final double mergeThreshold;
    private final int templateCap;

    private final Map<Integer, List<LogTemplate>> byTokenCount = new HashMap<>();
    private final Map<String, LogTemplate> byId = new HashMap<>();
    private final Map<String, Long> lastTouched = new HashMap<>();
    private final Map<String, TemplateActivity> activity = new HashMap<>();
    private final SessionTransitions transitions;
    private long touchSequence;

    private long totalLines;
    private long evictions;

    public ServiceTemplateSet(String service, double mergeThreshold, int templateCap) {
        this(service, mergeThreshold, templateCap, new LogMiningSettings().getSessionCap());
    }

    public ServiceTemplateSet(String service, double mergeThreshold, int templateCap, int sessionCap) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        if (!(mergeThreshold > 0 && mergeThreshold <= 1)) {
            throw new IllegalArgumentException("mergeThreshold must be in (0, 1], got: " + mergeThreshold);
        }
        if (templateCap < 1) {
            throw new IllegalArgumentException("templateCap must be >= 1, got: " + templateCap);
        }
        this.mergeThreshold = mergeThreshold;
        this.templateCap = templateCap;
        this.transitions = new SessionTransitions(sessionCap);
    }

    public static ServiceTemplateSet forService(String service, LogMiningSettings settings) {
        return new ServiceTemplateSet(service, settings.mergeThresholdFor(service), settings.templateCapFor(service),
                settings.getSessionCap());
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    public Placement place(List<String> tokens, Instant timestamp, LogSeverity severity, String rawLine,
            LogMiningSettings settings) {
        return place(tokens, timestamp, severity, rawLine, null, settings);
    }

    /**
     * @param sessionId session of the line, may be {@code null}
     */
    public Placement place(List<String> tokens, Instant timestamp, LogSeverity severity, String rawLine,
            String sessionId, LogMiningSettings settings) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        totalLines++;

        LogTemplate template = bestMatch(tokens);
        boolean created = template == null;
        LogTemplate evicted = null;
        if (created) {
            if (byId.size() >= templateCap) {
                evicted = evictLeastRecentlySeen();
            }
            template = new LogTemplate(TemplateIds.of(service, tokens), service, tokens, settings.getSampleCapacity());
            byTokenCount.computeIfAbsent(tokens.size(), n -> new ArrayList<>()).add(template);
            byId.put(template.getId(), template);
            activity.put(template.getId(), new TemplateActivity(settings.getRateHistoryMinutes()));
            LOG.debug("[{}] new template {}: {}", service, template.getId(), template.getTemplate());
        } else {
            for (int i = 0; i < tokens.size(); i++) {
                if (!template.isWildcard(i) && !template.token(i).equals(tokens.get(i))) {
                    template.generalize(i);
                }
            }
        }

        List<String> variables = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (template.isWildcard(i)) {
                variables.add(tokens.get(i));
            }
        }

        template.recordOccurrence(timestamp, severity, rawLine);
        template.setErrorPattern(template.errorRatio() > 0.5 || hasErrorKeyword(template));
        template.setRarePattern(template.getTotalCount() <= settings.getRareThreshold());
        lastTouched.put(template.getId(), ++touchSequence);

        TemplateActivity act = activity.get(template.getId());
        TemplateActivity.Deviation drop = act.advanceAndCheckDrop(timestamp, settings);
        TemplateActivity.Deviation spike = act.recordAndCheckRate(timestamp, settings);
        TemplateActivity.Deviation gap = act.recordAndCheckGap(timestamp, settings);
        SessionTransitions.Transition transition = transitions.record(sessionId, template.getId(), timestamp, settings);
        return new Placement(template, created, variables, evicted, spike, drop, transition, gap);
    }

    private LogTemplate bestMatch(List<String> tokens) {
        List<LogTemplate> candidates = byTokenCount.get(tokens.size());
        if (candidates == null) {
            return null;
        }
        LogTemplate best = null;
        double bestSimilarity = -1;
        for (LogTemplate candidate : candidates) {
            double s = similarity(candidate, tokens);
            if (s > bestSimilarity) {
                best = candidate;
                bestSimilarity = s;
            }
        }
        return bestSimilarity >= mergeThreshold ? best : null;
    }

    /**
     * Fraction of the template's literal positions matched by the line.
     */
    static double similarity(LogTemplate template, List<String> tokens) {
        if (template.tokenCount() != tokens.size()) {
            return 0.0;
        }
        int literal = 0;
        int equal = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (!template.isWildcard(i)) {
                literal++;
                if (template.token(i).equals(tokens.get(i))) {
                    equal++;
                }
            }
        }
        return literal == 0 ? 1.0 : (double) equal / literal;
    }

    private static boolean hasErrorKeyword(LogTemplate template) {
        for (String token : template.getTokens()) {
            if (LogTemplate.WILDCARD.equals(token)) {
                continue;
            }
            String lower = token.toLowerCase(Locale.ROOT);
            for (String keyword : ERROR_KEYWORDS) {
                if (lower.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private LogTemplate evictLeastRecentlySeen() {
        String oldestId = null;
        long oldest = Long.MAX_VALUE;
        for (Map.Entry<String, Long> e : lastTouched.entrySet()) {
            if (e.getValue() < oldest) {
                oldest = e.getValue();
                oldestId = e.getKey();
            }
        }
        LogTemplate victim = remove(oldestId);
        evictions++;
        if (evictions == 1) {
            LOG.warn("[{}] template cap {} reached, evicting least recently seen templates", service, templateCap);
        } else {
            LOG.debug("[{}] evicted template {}", service, oldestId);
        }
        return victim;
    }

    private LogTemplate remove(String id) {
        LogTemplate victim = byId.remove(id);
        lastTouched.remove(id);
        activity.remove(id);
        transitions.forget(id);
        if (victim != null) {
            List<LogTemplate> sameLength = byTokenCount.get(victim.tokenCount());
            sameLength.remove(victim);
            if (sameLength.isEmpty()) {
                byTokenCount.remove(victim.tokenCount());
            }
        }
        return victim;
    }

    // ---------------------------------------------------------------
    // Warm start
    // ---------------------------------------------------------------

    /**
     * Add a previously exported template. Templates already present by id are
     * replaced.
     */
    public void restore(LogTemplate template, LogMiningSettings settings) {
        Objects.requireNonNull(template, "template must not be null");
        if (!service.equals(template.getService())) {
            throw new IllegalArgumentException("Template " + template.getId() + " belongs to service "
                    + template.getService() + ", not " + service);
        }
        remove(template.getId());
        if (byId.size() >= templateCap) {
            evictLeastRecentlySeen();
        }
        LogTemplate own = template.copy();
        byTokenCount.computeIfAbsent(own.tokenCount(), n -> new ArrayList<>()).add(own);
        byId.put(own.getId(), own);
        activity.put(own.getId(), new TemplateActivity(settings.getRateHistoryMinutes()));
        lastTouched.put(own.getId(), ++touchSequence);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return live templates in creation order within each token count
     */
    public Collection<LogTemplate> templates() {
        List<LogTemplate> all = new ArrayList<>(byId.size());
        byTokenCount.keySet().stream().sorted().forEach(n -> all.addAll(byTokenCount.get(n)));
        return all;
    }

    public LogTemplate get(String id) {
        return byId.get(id);
    }

    public int size() {
        return byId.size();
    }

    public String service() {
        return service;
    }

    public long totalLines() {
        return totalLines;
    }

    public SessionTransitions transitions() {
        return transitions;
    }

    public long evictions() {
        return evictions;
    }

    public double mergeThreshold() {
        return mergeThreshold;
    }

    public int templateCap() {
        return templateCap;
    }
}
