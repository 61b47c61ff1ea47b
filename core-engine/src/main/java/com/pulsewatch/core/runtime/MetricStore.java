package com.pulsewatch.core.runtime;

import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Storage engine operations the analytics engine consumes. Implementations
 * live outside this module.
 *
 * <p>
 * Time ranges are half-open: {@code [from, to)}.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricStore {

    void appendSample(MetricSample sample);

    List<MetricSample> querySamples(String service, String metricName, Instant from, Instant to);

    void appendLog(LogRecord record);

    List<LogRecord> queryLogs(String service, Instant from, Instant to);
}
