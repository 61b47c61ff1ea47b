package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A raw log line as delivered by the ingestion pipeline.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LogRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String service;
    private final Instant timestamp;
    private final String severity;
    private final String body;
    private final String sessionId;

    @JsonCreator
    public LogRecord(@JsonProperty("service") String service,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("severity") String severity,
            @JsonProperty("body") String body,
            @JsonProperty("sessionId") String sessionId) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.severity = severity;
        this.body = body != null ? body : "";
        this.sessionId = sessionId;
    }

    public LogRecord(String service, Instant timestamp, String severity, String body) {
        this(service, timestamp, severity, body, null);
    }

    public String getService() {
        return service;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSeverity() {
        return severity;
    }

    public String getBody() {
        return body;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogRecord that))
            return false;
        return service.equals(that.service)
                && timestamp.equals(that.timestamp)
                && Objects.equals(severity, that.severity)
                && body.equals(that.body)
                && Objects.equals(sessionId, that.sessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, timestamp, severity, body, sessionId);
    }

    @Override
    public String toString() {
        return "LogRecord{" + service + " @" + timestamp + " [" + severity + "] " + body + '}';
    }
}
