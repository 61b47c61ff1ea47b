package com.pulsewatch.core.slo;

import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;

/**
 * Output of one SLO tick.
 *
 * @since 1.0.0
 */
public record SloEvaluation(SloMeasurement measurement, SloStatus status) {
}
