package com.pulsewatch.core.config;

import java.io.Serializable;

/**
 * Effective detection settings for one series after applying overrides.
 *
 * @since 1.0.0
 */
public record DetectionThresholds(ScoringMode mode, double warningSigma, double criticalSigma)
        implements Serializable {
}
