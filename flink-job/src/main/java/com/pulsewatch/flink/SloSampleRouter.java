package com.pulsewatch.flink;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeriesKey;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.runtime.SliClassifier;
import com.pulsewatch.core.slo.SloEvaluator;
import org.apache.flink.api.common.functions.RichFlatMapFunction;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.Collector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies every metric sample against the SLOs defined on its series and
 * emits one {@link SloCountTick} per matching SLO.
 *
 * @since 1.0.0
 */
public class SloSampleRouter extends RichFlatMapFunction<MetricSample, SloCountTick> {

    private static final long serialVersionUID = 1L;

    private final AnalyticsConfig config;

    /** Valid SLO definitions by series, built in {@link #open}. */
    private transient Map<SeriesKey, List<SloDefinition>> bySeries;

    public SloSampleRouter(AnalyticsConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        bySeries = index(new SloEvaluator(config).definitions());
    }

    @Override
    public void flatMap(MetricSample sample, Collector<SloCountTick> out) {
        for (SloDefinition def : bySeries.getOrDefault(sample.seriesKey(), Collections.emptyList())) {
            long[] counts = SliClassifier.classify(def, List.of(sample));
            if (counts[0] + counts[1] > 0) {
                out.collect(new SloCountTick(def.getId(), sample.getTimestamp(), counts[0], counts[1]));
            }
        }
    }

    static Map<SeriesKey, List<SloDefinition>> index(Iterable<SloDefinition> definitions) {
        Map<SeriesKey, List<SloDefinition>> index = new HashMap<>();
        for (SloDefinition def : definitions) {
            index.computeIfAbsent(new SeriesKey(def.getService(), def.getMetricName()), k -> new ArrayList<>())
                    .add(def);
        }
        return index;
    }
}
