package com.pulsewatch.flink;

import com.pulsewatch.core.baseline.BaselineAccumulator;
import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.baseline.HourlyRollup;
import com.pulsewatch.core.baseline.SeasonalBaselineEstimator;
import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.detection.ScorerFactory;
import com.pulsewatch.core.detection.SeriesAnomalyScorer;
import com.pulsewatch.core.detection.TrailingWindow;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores metric samples of one series (key {@code service|metric}) and keeps
 * its seasonal baseline up to date.
 *
 * <h3>State Management</h3>
 * <ul>
 * <li>{@code ValueState<TrailingWindow>}: the z-score trailing window</li>
 * <li>{@code ValueState<HourlyRollup>}: moments of the hour being filled</li>
 * <li>{@code ListState<HourlyRollup>}: closed hours of the lookback window,
 * the baseline's history</li>
 * </ul>
 * <p>
 * The baseline itself is derived data: it is cached per key on the task and
 * rebuilt from the rollups after a restore. An event-time timer recomputes it
 * every {@code recomputeIntervalMinutes}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricAnomalyProcessFunction
        extends KeyedProcessFunction<String, MetricSample, AnomalyEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricAnomalyProcessFunction.class);

    private final AnalyticsConfig config;

    private transient ValueState<TrailingWindow> windowState;
    private transient ValueState<HourlyRollup> openHourState;
    private transient ListState<HourlyRollup> closedHoursState;
    private transient ValueState<Long> nextRecomputeState;

    private transient SeasonalBaselineEstimator estimator;
    private transient HolidayCalendar calendar;
    private transient Map<String, SeasonalBaseline> baselines;
    private transient PipelineMetrics metrics;

    public MetricAnomalyProcessFunction(AnalyticsConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        windowState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("trailing-window", TypeInformation.of(TrailingWindow.class)));
        openHourState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("open-hour", TypeInformation.of(HourlyRollup.class)));
        closedHoursState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("closed-hours", TypeInformation.of(HourlyRollup.class)));
        nextRecomputeState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("next-recompute", Types.LONG));

        estimator = new SeasonalBaselineEstimator(config.getBaseline());
        calendar = HolidayCalendar.from(config.getBaseline());
        baselines = new HashMap<>();
        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("MetricAnomalyProcessFunction opened: mode={}, recompute every {} min",
                config.getDetection().getMode(), config.getBaseline().getRecomputeIntervalMinutes());
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricSample sample,
            KeyedProcessFunction<String, MetricSample, AnomalyEvent>.Context ctx,
            Collector<AnomalyEvent> out) throws Exception {
        long startNanos = System.nanoTime();
        String key = ctx.getCurrentKey();

        SeriesAnomalyScorer scorer = ScorerFactory.forSeries(sample.getService(), sample.getMetricName(),
                config, calendar, windowState.value());
        Optional<AnomalyEvent> event = scorer.score(sample, baseline(key, sample, ctx.timestamp()));
        if (scorer.window() != null) {
            windowState.update(scorer.window());
        }
        if (event.isPresent()) {
            out.collect(event.get());
            metrics.incrementAnomaliesDetected();
            LOG.debug("Anomaly {} on {} severity={} score={}", event.get().getMethod().label(), key,
                    event.get().getSeverity(), event.get().getScore());
        }

        rollUp(sample);

        if (nextRecomputeState.value() == null) {
            long next = sample.getTimestamp().toEpochMilli() + recomputeMillis();
            ctx.timerService().registerEventTimeTimer(next);
            nextRecomputeState.update(next);
        }

        metrics.incrementRecordsProcessed();
        metrics.recordLatency(startNanos);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, MetricSample, AnomalyEvent>.OnTimerContext ctx,
            Collector<AnomalyEvent> out) throws Exception {
        String key = ctx.getCurrentKey();
        SeasonalBaseline baseline = recompute(key, Instant.ofEpochMilli(timestamp));
        if (baseline != null) {
            baselines.put(key, baseline);
            metrics.incrementBaselineRecomputes();
            LOG.info("Baseline for {} recomputed: samples={}, dominant={}", key, baseline.getSampleCount(),
                    baseline.getDominantPeriod().label());
        }
        long next = timestamp + recomputeMillis();
        ctx.timerService().registerEventTimeTimer(next);
        nextRecomputeState.update(next);
    }

    // ---------------------------------------------------------------
    // Baseline
    // ---------------------------------------------------------------

    private SeasonalBaseline baseline(String key, MetricSample sample, Long eventTime) throws Exception {
        if (!baselines.containsKey(key)) {
            // first sample of the key on this task, possibly after a restore
            Instant now = eventTime != null ? Instant.ofEpochMilli(eventTime) : sample.getTimestamp();
            baselines.put(key, recompute(key, now));
        }
        return baselines.get(key);
    }

    /**
     * Prune rollups older than the lookback window and build a baseline
     * from the rest.
     *
     * @return {@code null} when the series has no history yet
     */
    private SeasonalBaseline recompute(String key, Instant now) throws Exception {
        Instant cutoff = now.minus(config.getBaseline().lookback());
        List<HourlyRollup> kept = new ArrayList<>();
        Iterable<HourlyRollup> closed = closedHoursState.get();
        if (closed != null) {
            for (HourlyRollup rollup : closed) {
                if (!rollup.isOlderThan(cutoff)) {
                    kept.add(rollup);
                }
            }
        }
        closedHoursState.update(kept);

        BaselineAccumulator acc = new BaselineAccumulator(config.getBaseline().zone());
        kept.forEach(acc::add);
        HourlyRollup open = openHourState.value();
        if (open != null) {
            acc.add(open);
        }
        if (acc.count() == 0) {
            return null;
        }
        int sep = key.indexOf('|');
        return estimator.compute(key.substring(0, sep), key.substring(sep + 1), acc, now);
    }

    private void rollUp(MetricSample sample) throws Exception {
        if (!Double.isFinite(sample.getValue())) {
            return;
        }
        HourlyRollup open = openHourState.value();
        Instant ts = sample.getTimestamp();
        if (open != null && !open.covers(ts)) {
            if (ts.isBefore(open.getHourStart())) {
                metrics.incrementLateRecords();
                return;
            }
            closedHoursState.add(open);
            open = null;
        }
        if (open == null) {
            open = new HourlyRollup(HourlyRollup.hourOf(ts));
        }
        open.add(ts, sample.getValue());
        openHourState.update(open);
    }

    private long recomputeMillis() {
        return config.getBaseline().recomputeInterval().toMillis();
    }
}
