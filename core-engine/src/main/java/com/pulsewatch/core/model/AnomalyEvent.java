package com.pulsewatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Anomaly emitted by the metric detector or by the log-pattern sub-detector.
 *
 * <p>
 * Immutable once built and published to the anomaly stream consumed by
 * external alerting and dashboards.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code service}, {@code metricOrPattern},
 * {@code timestamp}, {@code method} and {@code severity} are required;
 * omitting any of them throws a {@link NullPointerException} at build time.
 * {@code score} and {@code confidence} are clamped to {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String service;
    private final String metricOrPattern;
    private final Instant timestamp;
    private final double observed;
    private final double expected;
    private final double expectedStd;
    private final double deviationSigma;
    private final double score;
    private final double confidence;
    private final DetectionMethod method;
    private final Severity severity;

    /** Human-readable description of what was detected. */
    private final String details;

    private AnomalyEvent(Builder builder) {
        this.service = Objects.requireNonNull(builder.service, "service must not be null");
        this.metricOrPattern = Objects.requireNonNull(builder.metricOrPattern,
                "metricOrPattern must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.observed = builder.observed;
        this.expected = builder.expected;
        this.expectedStd = builder.expectedStd;
        this.deviationSigma = builder.deviationSigma;
        this.score = clampUnit(builder.score);
        this.confidence = clampUnit(builder.confidence);
        this.details = builder.details;
    }

    private static double clampUnit(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyEvent} instances.
     */
    public static class Builder {
        private String service;
        private String metricOrPattern;
        private Instant timestamp;
        private double observed;
        private double expected;
        private double expectedStd;
        private double deviationSigma;
        private double score;
        private double confidence;
        private DetectionMethod method;
        private Severity severity;
        private String details;

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder metricOrPattern(String metricOrPattern) {
            this.metricOrPattern = metricOrPattern;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder observed(double observed) {
            this.observed = observed;
            return this;
        }

        public Builder expected(double expected) {
            this.expected = expected;
            return this;
        }

        public Builder expectedStd(double expectedStd) {
            this.expectedStd = expectedStd;
            return this;
        }

        public Builder deviationSigma(double deviationSigma) {
            this.deviationSigma = deviationSigma;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * @return a new {@link AnomalyEvent}
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getService() {
        return service;
    }

    public String getMetricOrPattern() {
        return metricOrPattern;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getObserved() {
        return observed;
    }

    public double getExpected() {
        return expected;
    }

    public double getExpectedStd() {
        return expectedStd;
    }

    public double getDeviationSigma() {
        return deviationSigma;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return Objects.equals(service, that.service)
                && Objects.equals(metricOrPattern, that.metricOrPattern)
                && Objects.equals(timestamp, that.timestamp)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, metricOrPattern, timestamp, method);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "service='" + service + '\'' +
                ", metricOrPattern='" + metricOrPattern + '\'' +
                ", timestamp=" + timestamp +
                ", observed=" + observed +
                ", expected=" + expected +
                ", deviationSigma=" + deviationSigma +
                ", method=" + method +
                ", severity=" + severity +
                '}';
    }
}
