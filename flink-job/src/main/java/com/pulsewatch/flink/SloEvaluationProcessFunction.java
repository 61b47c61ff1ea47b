package com.pulsewatch.flink;

import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.error.InvalidConfigurationException;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;
import com.pulsewatch.core.slo.SloEvaluation;
import com.pulsewatch.core.slo.SloEvaluator;
import com.pulsewatch.core.slo.SloState;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Evaluates one SLO (key {@code sloId}) once per tick.
 *
 * <p>
 * Counts arriving between two tick boundaries are summed; an event-time timer
 * at each boundary evaluates the tick, emits the status on the main output and
 * the measurement to {@link #MEASUREMENTS}. Once an SLO has seen data its
 * timer keeps firing, so a tick without events is evaluated as data
 * insufficient rather than skipped.
 * </p>
 *
 * <h3>State Management</h3>
 * <ul>
 * <li>{@code ValueState<SloState>}: rolling counters, alert state, last status</li>
 * <li>{@code ValueState<long[]>}: good and bad counts of the open tick</li>
 * <li>{@code ValueState<Long>}: the registered tick boundary</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SloEvaluationProcessFunction
        extends KeyedProcessFunction<String, SloCountTick, SloStatus> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SloEvaluationProcessFunction.class);

    public static final OutputTag<SloMeasurement> MEASUREMENTS =
            new OutputTag<>("slo-measurements", TypeInformation.of(SloMeasurement.class));

    private final AnalyticsConfig config;

    private transient ValueState<SloState> sloState;
    private transient ValueState<long[]> pendingState;
    private transient ValueState<Long> nextTickState;

    private transient SloEvaluator evaluator;
    private transient PipelineMetrics metrics;

    public SloEvaluationProcessFunction(AnalyticsConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        sloState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("slo-state", TypeInformation.of(SloState.class)));
        pendingState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("slo-pending", TypeInformation.of(long[].class)));
        nextTickState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("slo-next-tick", Types.LONG));

        evaluator = new SloEvaluator(config);
        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
    }

    @Override
    public void processElement(SloCountTick tick,
            KeyedProcessFunction<String, SloCountTick, SloStatus>.Context ctx,
            Collector<SloStatus> out) throws Exception {
        SloDefinition def;
        try {
            def = evaluator.definition(tick.getSloId());
        } catch (InvalidConfigurationException e) {
            metrics.incrementUnknownSlo();
            LOG.debug("Dropping counts: {}", e.getMessage());
            return;
        }

        long[] pending = pendingState.value();
        if (pending == null) {
            pending = new long[2];
        }
        pending[0] += tick.getGoodCount();
        pending[1] += tick.getBadCount();
        pendingState.update(pending);

        if (nextTickState.value() == null) {
            if (sloState.value() == null) {
                sloState.update(new SloState(def));
            }
            long boundary = tickBoundary(tick.getTimestamp().toEpochMilli());
            ctx.timerService().registerEventTimeTimer(boundary);
            nextTickState.update(boundary);
        }
        metrics.incrementRecordsProcessed();
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, SloCountTick, SloStatus>.OnTimerContext ctx,
            Collector<SloStatus> out) throws Exception {
        long startNanos = System.nanoTime();
        String sloId = ctx.getCurrentKey();
        SloDefinition def = evaluator.definition(sloId);

        SloState state = sloState.value();
        if (state == null) {
            state = new SloState(def);
        }
        long[] pending = pendingState.value();
        long good = pending != null ? pending[0] : 0;
        long bad = pending != null ? pending[1] : 0;

        SloEvaluation evaluation = SloEvaluator.evaluate(def, state, evaluator.settings(), good, bad,
                tickStart(timestamp));
        sloState.update(state);
        pendingState.clear();

        out.collect(evaluation.status());
        ctx.output(MEASUREMENTS, evaluation.measurement());
        metrics.incrementSloTicks(evaluation.measurement().isDataInsufficient());

        long next = timestamp + tickMillis();
        ctx.timerService().registerEventTimeTimer(next);
        nextTickState.update(next);
        metrics.recordLatency(startNanos);
    }

    /**
     * End of the tick containing {@code epochMillis}.
     */
    long tickBoundary(long epochMillis) {
        long tick = tickMillis();
        return Math.floorDiv(epochMillis, tick) * tick + tick;
    }

    /**
     * Start of the tick ending at {@code boundary}; the tick's counts are
     * booked into the buckets of this instant.
     */
    Instant tickStart(long boundary) {
        return Instant.ofEpochMilli(boundary - tickMillis());
    }

    private long tickMillis() {
        return config.getSlo().tick().toMillis();
    }
}
