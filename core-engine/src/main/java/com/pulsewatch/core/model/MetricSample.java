package com.pulsewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation produced by the ingestion pipeline.
 *
 * <p>
 * Immutable. The engine never creates samples of its own; it only reads them
 * from the ingestion stream or from storage range queries.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String service;
    private final String metricName;
    private final Instant timestamp;
    private final double value;

    /**
     * @throws NullPointerException if {@code service}, {@code metricName} or
     *                              {@code timestamp} is {@code null}
     */
    @JsonCreator
    public MetricSample(@JsonProperty("service") String service,
            @JsonProperty("metricName") String metricName,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") double value) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public String getService() {
        return service;
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the (service, metric) key this sample belongs to
     */
    public SeriesKey seriesKey() {
        return new SeriesKey(service, metricName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && service.equals(that.service)
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, metricName, timestamp, value);
    }

    @Override
    public String toString() {
        return "MetricSample{" + service + '/' + metricName + " @" + timestamp + " = " + value + '}';
    }
}
