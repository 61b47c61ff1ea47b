package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One line matched to a template. Derived per line and emitted, never retained.
 *
 * @since 1.0.0
 */
public final class LogPatternOccurrence implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String templateId;
    private final String service;
    private final Instant timestamp;
    private final String sessionId;
    private final List<String> extractedVariables;

    public LogPatternOccurrence(String templateId, String service, Instant timestamp,
            String sessionId, List<String> extractedVariables) {
        this.templateId = Objects.requireNonNull(templateId, "templateId must not be null");
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.sessionId = sessionId;
        this.extractedVariables = extractedVariables != null ? List.copyOf(extractedVariables) : List.of();
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getService() {
        return service;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the session the line belongs to, or {@code null} when unknown
     */
    public String getSessionId() {
        return sessionId;
    }

    public List<String> getExtractedVariables() {
        return extractedVariables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogPatternOccurrence that))
            return false;
        return templateId.equals(that.templateId)
                && service.equals(that.service)
                && timestamp.equals(that.timestamp)
                && Objects.equals(sessionId, that.sessionId)
                && extractedVariables.equals(that.extractedVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(templateId, service, timestamp, sessionId, extractedVariables);
    }

    @Override
    public String toString() {
        return "LogPatternOccurrence{" +
                "templateId='" + templateId + '\'' +
                ", timestamp=" + timestamp +
                ", variables=" + extractedVariables +
                '}';
    }
}
