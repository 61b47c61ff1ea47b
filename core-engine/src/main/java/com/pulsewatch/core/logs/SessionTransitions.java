package com.pulsewatch.core.logs;

import com.pulsewatch.core.config.LogMiningSettings;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template-to-template transition counts within the sessions of one service.
 *
 * <p>
 * Each session remembers the template of its previous line. A line that
 * follows it within {@code sessionWindowSeconds} counts as a transition
 * {@code A -> B}. Once {@code A} has been left at least
 * {@code minTransitionCount} times, a transition whose observed probability
 * {@code P(B | A)} is below {@code lowTransitionProbability} is reported;
 * a transition never seen before has probability 0.
 * </p>
 *
 * <p>
 * Only the most recently active {@code sessionCap} sessions are remembered.
 * Not thread-safe; owned by a {@link ServiceTemplateSet}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SessionTransitions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** An improbable transition. {@code likelyNext} is the most frequent successor of {@code from}. */
    public record Transition(String from, String to, long count, long total, double probability,
            String likelyNext) {
    }

    private static final class LastLine implements Serializable {
        private static final long serialVersionUID = 1L;
        private final String templateId;
        private final long millis;

        LastLine(String templateId, long millis) {
            this.templateId = templateId;
            this.millis = millis;
        }
    }

    private static final class SessionMap extends LinkedHashMap<String, LastLine> {
        private static final long serialVersionUID = 1L;
        private final int cap;

        SessionMap(int cap) {
            super(16, 0.75f, true);
            this.cap = cap;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, LastLine> eldest) {
            return size() > cap;
        }
    }

    private final SessionMap sessions;
    private final Map<String, Map<String, Long>> counts = new HashMap<>();
    private final Map<String, Long> totals = new HashMap<>();

    public SessionTransitions(int sessionCap) {
        if (sessionCap < 1) {
            throw new IllegalArgumentException("sessionCap must be >= 1, got: " + sessionCap);
        }
        this.sessions = new SessionMap(sessionCap);
    }

    /**
     * Record that {@code templateId} was seen in {@code sessionId}.
     *
     * @return the transition into it when improbable, otherwise {@code null}
     */
    public Transition record(String sessionId, String templateId, Instant timestamp, LogMiningSettings settings) {
        if (sessionId == null || sessionId.isEmpty()) {
            return null;
        }
        long now = timestamp.toEpochMilli();
        LastLine last = sessions.get(sessionId);
        Transition result = null;
        if (last != null && now - last.millis <= settings.getSessionWindowSeconds() * 1000L) {
            result = check(last.templateId, templateId, settings);
            counts.computeIfAbsent(last.templateId, k -> new HashMap<>()).merge(templateId, 1L, Long::sum);
            totals.merge(last.templateId, 1L, Long::sum);
        }
        if (last == null || now >= last.millis) {
            sessions.put(sessionId, new LastLine(templateId, now));
        }
        return result;
    }

    private Transition check(String from, String to, LogMiningSettings settings) {
        long total = totals.getOrDefault(from, 0L);
        if (total < settings.getMinTransitionCount()) {
            return null;
        }
        Map<String, Long> next = counts.get(from);
        long count = next.getOrDefault(to, 0L);
        double probability = (double) count / total;
        if (probability >= settings.getLowTransitionProbability()) {
            return null;
        }
        return new Transition(from, to, count, total, probability, likelyNext(next));
    }

    private static String likelyNext(Map<String, Long> next) {
        String best = null;
        long bestCount = -1;
        for (Map.Entry<String, Long> e : next.entrySet()) {
            if (e.getValue() > bestCount || (e.getValue() == bestCount && e.getKey().compareTo(best) < 0)) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    /**
     * Drop the outgoing transitions of an evicted template.
     */
    void forget(String templateId) {
        counts.remove(templateId);
        totals.remove(templateId);
    }

    /**
     * @return {@code P(to | from)} observed so far, 0 when {@code from} was never left
     */
    public double probability(String from, String to) {
        long total = totals.getOrDefault(from, 0L);
        if (total == 0) {
            return 0.0;
        }
        return (double) counts.get(from).getOrDefault(to, 0L) / total;
    }

    public int sessionCount() {
        return sessions.size();
    }
}
