package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for one metric scoring method.
 *
 * <p>
 * A scorer is bound to a single series. Implementations may keep a bounded
 * buffer of recent observations but no other cross-call state. Scorers must
 * be {@link Serializable} because Flink snapshots them in keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricScorer extends Serializable {

    /**
     * Score one sample.
     *
     * @param sample   the observation
     * @param baseline current baseline of the series, {@code null} if none has been published
     * @return an event when the deviation is outside the normal range, empty otherwise
     */
    Optional<AnomalyEvent> score(MetricSample sample, SeasonalBaseline baseline);

    /**
     * @return the method reported on emitted events
     */
    DetectionMethod method();
}
