package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A log-line pattern made of literal tokens and {@value #WILDCARD} wildcards.
 *
 * <p>
 * Owned and mutated in place by the log template miner of its service. The
 * id is a content hash fixed when the template is created, so it stays
 * stable while positions are generalized into wildcards.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Only the worker owning the service mutates a template;
 * anything published to a sink must be a {@link #copy()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogTemplate implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Token standing in for variable content. */
    public static final String WILDCARD = "<*>";

    private final String id;
    private final String service;
    private final List<String> tokens;
    private final int sampleCapacity;
    private final List<String> sampleLines;

    /** Indexed by {@link LogSeverity#ordinal()}. */
    private final long[] severityCounts = new long[LogSeverity.values().length];

    private long totalCount;
    private Instant firstSeen;
    private Instant lastSeen;
    private boolean errorPattern;
    private boolean rarePattern;

    /**
     * Create an empty template from the tokens of the line that introduced it.
     *
     * @param id             content-derived id
     * @param service        owning service
     * @param tokens         creation tokens
     * @param sampleCapacity maximum number of retained sample lines, at least 1
     */
    public LogTemplate(String id, String service, List<String> tokens, int sampleCapacity) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.service = Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("tokens must not be empty");
        }
        if (sampleCapacity < 1) {
            throw new IllegalArgumentException("sampleCapacity must be >= 1, got: " + sampleCapacity);
        }
        this.tokens = new ArrayList<>(tokens);
        this.sampleCapacity = sampleCapacity;
        this.sampleLines = new ArrayList<>(sampleCapacity);
    }

    // ---------------------------------------------------------------
    // Mutation (owning miner only)
    // ---------------------------------------------------------------

    /**
     * Account for one matching line.
     *
     * @param timestamp line timestamp
     * @param severity  line severity
     * @param line      raw line body, appended to the bounded sample buffer
     */
    public void recordOccurrence(Instant timestamp, LogSeverity severity, String line) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        totalCount++;
        if (firstSeen == null || timestamp.isBefore(firstSeen)) {
            firstSeen = timestamp;
        }
        if (lastSeen == null || timestamp.isAfter(lastSeen)) {
            lastSeen = timestamp;
        }
        severityCounts[(severity != null ? severity : LogSeverity.INFO).ordinal()]++;
        if (line != null) {
            addSample(line);
        }
    }

    /**
     * Turn a literal position into a wildcard.
     *
     * @param position token index
     * @return {@code true} if the position was literal before the call
     */
    public boolean generalize(int position) {
        if (WILDCARD.equals(tokens.get(position))) {
            return false;
        }
        tokens.set(position, WILDCARD);
        return true;
    }

    private void addSample(String line) {
        if (sampleLines.size() == sampleCapacity) {
            sampleLines.remove(0);
        }
        sampleLines.add(line);
    }

    public void setErrorPattern(boolean errorPattern) {
        this.errorPattern = errorPattern;
    }

    public void setRarePattern(boolean rarePattern) {
        this.rarePattern = rarePattern;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public int tokenCount() {
        return tokens.size();
    }

    public String token(int position) {
        return tokens.get(position);
    }

    public boolean isWildcard(int position) {
        return WILDCARD.equals(tokens.get(position));
    }

    /**
     * @return fraction of lines logged at ERROR or FATAL
     */
    public double errorRatio() {
        if (totalCount == 0) {
            return 0.0;
        }
        return (double) (severityCounts[LogSeverity.ERROR.ordinal()] + severityCounts[LogSeverity.FATAL.ordinal()])
                / totalCount;
    }

    /**
     * @return a detached deep copy, safe to hand to sinks and other threads
     */
    public LogTemplate copy() {
        LogTemplate copy = new LogTemplate(id, service, tokens, sampleCapacity);
        copy.totalCount = totalCount;
        copy.firstSeen = firstSeen;
        copy.lastSeen = lastSeen;
        System.arraycopy(severityCounts, 0, copy.severityCounts, 0, severityCounts.length);
        copy.sampleLines.addAll(sampleLines);
        copy.errorPattern = errorPattern;
        copy.rarePattern = rarePattern;
        return copy;
    }

    /**
     * Rebuild a template from exported state.
     *
     * @return a template carrying exactly the given counters
     */
    public static LogTemplate restore(String id, String service, List<String> tokens, int sampleCapacity,
            long totalCount, Instant firstSeen, Instant lastSeen,
            Map<LogSeverity, Long> severityCounts, List<String> sampleLines) {
        LogTemplate t = new LogTemplate(id, service, tokens, sampleCapacity);
        t.totalCount = totalCount;
        t.firstSeen = firstSeen;
        t.lastSeen = lastSeen;
        if (severityCounts != null) {
            severityCounts.forEach((severity, count) -> t.severityCounts[severity.ordinal()] = count);
        }
        if (sampleLines != null) {
            sampleLines.forEach(t::addSample);
        }
        return t;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getService() {
        return service;
    }

    public List<String> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * @return the canonical template string, tokens joined by single spaces
     */
    public String getTemplate() {
        return String.join(" ", tokens);
    }

    public long getTotalCount() {
        return totalCount;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public Map<LogSeverity, Long> getSeverityCounts() {
        Map<LogSeverity, Long> counts = new EnumMap<>(LogSeverity.class);
        for (LogSeverity s : LogSeverity.values()) {
            counts.put(s, severityCounts[s.ordinal()]);
        }
        return Collections.unmodifiableMap(counts);
    }

    public long getSeverityCount(LogSeverity severity) {
        return severityCounts[severity.ordinal()];
    }

    public List<String> getSampleLines() {
        return List.copyOf(sampleLines);
    }

    public int getSampleCapacity() {
        return sampleCapacity;
    }

    public boolean isErrorPattern() {
        return errorPattern;
    }

    public boolean isRarePattern() {
        return rarePattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogTemplate that))
            return false;
        return id.equals(that.id) && service.equals(that.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, service);
    }

    @Override
    public String toString() {
        return "LogTemplate{" +
                "id='" + id + '\'' +
                ", service='" + service + '\'' +
                ", template='" + getTemplate() + '\'' +
                ", totalCount=" + totalCount +
                '}';
    }
}
