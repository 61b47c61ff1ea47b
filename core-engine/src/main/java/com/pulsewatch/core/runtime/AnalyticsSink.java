package com.pulsewatch.core.runtime;

import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogPatternOccurrence;
import com.pulsewatch.core.model.LogTemplate;
import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;

/**
 * Receives the engine's output streams. Templates are upserts keyed by id,
 * SLO statuses are upserts keyed by SLO id, everything else is append-only.
 *
 * <p>
 * Called from worker threads; implementations must be thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnalyticsSink {

    default void onAnomaly(AnomalyEvent event) {
    }

    default void onTemplate(LogTemplate template) {
    }

    default void onOccurrence(LogPatternOccurrence occurrence) {
    }

    default void onMeasurement(SloMeasurement measurement) {
    }

    default void onStatus(SloStatus status) {
    }
}
