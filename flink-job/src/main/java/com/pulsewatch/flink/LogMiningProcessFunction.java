package com.pulsewatch.flink;

import com.pulsewatch.core.config.LogMiningSettings;
import com.pulsewatch.core.logs.IngestResult;
import com.pulsewatch.core.logs.LogTemplateMiner;
import com.pulsewatch.core.logs.ServiceTemplateSet;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogPatternOccurrence;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.LogSeverity;
import com.pulsewatch.core.model.LogTemplate;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Mines log templates of one service (key {@code service}).
 *
 * <p>
 * The main output carries pattern anomalies. Every line also emits its
 * template upsert to {@link #TEMPLATES} and its occurrence to
 * {@link #OCCURRENCES}.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<ServiceTemplateSet>} holds the service's templates,
 * its similarity index and pattern activity, so template ids and counts
 * survive restarts through checkpoints.
 * </p>
 *
 * @since 1.0.0
 */
public class LogMiningProcessFunction
        extends KeyedProcessFunction<String, LogRecord, AnomalyEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LogMiningProcessFunction.class);

    public static final OutputTag<LogTemplate> TEMPLATES =
            new OutputTag<>("log-templates", TypeInformation.of(LogTemplate.class));
    public static final OutputTag<LogPatternOccurrence> OCCURRENCES =
            new OutputTag<>("log-occurrences", TypeInformation.of(LogPatternOccurrence.class));

    private final LogMiningSettings settings;

    private transient ValueState<ServiceTemplateSet> templatesState;
    private transient PipelineMetrics metrics;

    public LogMiningProcessFunction(LogMiningSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        templatesState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("service-templates", TypeInformation.of(ServiceTemplateSet.class)));
        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("LogMiningProcessFunction opened: mergeThreshold={}, templateCap={}",
                settings.getMergeThreshold(), settings.getTemplateCap());
    }

    @Override
    public void processElement(LogRecord record,
            KeyedProcessFunction<String, LogRecord, AnomalyEvent>.Context ctx,
            Collector<AnomalyEvent> out) throws Exception {
        long startNanos = System.nanoTime();

        ServiceTemplateSet set = templatesState.value();
        if (set == null) {
            set = ServiceTemplateSet.forService(ctx.getCurrentKey(), settings);
        }

        IngestResult result = LogTemplateMiner.ingest(set, record.getTimestamp(),
                LogSeverity.parse(record.getSeverity()), record.getBody(), record.getSessionId(), settings);
        templatesState.update(set);

        ctx.output(TEMPLATES, result.template());
        ctx.output(OCCURRENCES, result.occurrence());
        if (result.evicted() != null) {
            metrics.incrementTemplateEvictions();
        }
        if (result.anomaly().isPresent()) {
            out.collect(result.anomaly().get());
            metrics.incrementAnomaliesDetected();
        }

        metrics.incrementRecordsProcessed();
        metrics.recordLatency(startNanos);
    }
}
