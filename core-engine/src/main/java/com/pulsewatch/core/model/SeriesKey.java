package com.pulsewatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Partition key of the baseline and anomaly pipelines: one metric of one
 * service.
 *
 * @param service    owning service
 * @param metricName metric name
 * @since 1.0.0
 */
public record SeriesKey(String service, String metricName) implements Serializable {

    public SeriesKey {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
    }

    @Override
    public String toString() {
        return service + '|' + metricName;
    }
}
