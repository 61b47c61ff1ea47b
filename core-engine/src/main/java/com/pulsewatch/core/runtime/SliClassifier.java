package com.pulsewatch.core.runtime;

import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SliOperator;
import com.pulsewatch.core.model.SloDefinition;

import java.util.Collection;

/**
 * Turns raw samples of an SLO's metric into good/bad event counts.
 *
 * @since 1.0.0
 */
public final class SliClassifier {

    private SliClassifier() {
    }

    /**
     * @return {@code [good, bad]}; non-finite values are ignored
     */
    public static long[] classify(SloDefinition definition, Collection<MetricSample> samples) {
        SliOperator operator = definition.comparison();
        double threshold = definition.getThreshold();
        long good = 0;
        long bad = 0;
        for (MetricSample s : samples) {
            double v = s.getValue();
            if (!Double.isFinite(v)) {
                continue;
            }
            if (operator.isGood(v, threshold)) {
                good++;
            } else {
                bad++;
            }
        }
        return new long[] {good, bad};
    }
}
