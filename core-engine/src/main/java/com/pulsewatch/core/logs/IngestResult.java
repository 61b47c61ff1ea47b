package com.pulsewatch.core.logs;

import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogPatternOccurrence;
import com.pulsewatch.core.model.LogTemplate;

import java.util.Optional;

/**
 * Result of ingesting one log line.
 *
 * @param template   detached copy of the matched or created template
 * @param occurrence the line's occurrence record
 * @param anomaly    pattern anomaly raised by the line, if any
 * @param created    {@code true} if the line created the template
 * @param evicted    template evicted to make room, or {@code null}
 * @since 1.0.0
 */
public record IngestResult(LogTemplate template, LogPatternOccurrence occurrence,
        Optional<AnomalyEvent> anomaly, boolean created, LogTemplate evicted) {
}
