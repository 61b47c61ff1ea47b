package com.pulsewatch.core.runtime;

import com.pulsewatch.core.baseline.BaselineRegistry;
import com.pulsewatch.core.baseline.HolidayCalendar;
import com.pulsewatch.core.baseline.SeasonalBaselineEstimator;
import com.pulsewatch.core.config.AnalyticsConfig;
import com.pulsewatch.core.detection.AnomalyDetector;
import com.pulsewatch.core.error.StorageUnavailableException;
import com.pulsewatch.core.logs.IngestResult;
import com.pulsewatch.core.logs.LogTemplateMiner;
import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogRecord;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeriesKey;
import com.pulsewatch.core.model.SloDefinition;
import com.pulsewatch.core.model.SloStatus;
import com.pulsewatch.core.slo.SloEvaluation;
import com.pulsewatch.core.slo.SloEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process runtime wiring the four analytics components to a metric
 * store and an output sink.
 *
 * <h3>Keys and workers</h3>
 * <ul>
 * <li>metric samples: {@code metric|service|metric}</li>
 * <li>baseline recompute: {@code baseline|service|metric}, so recompute may
 * run alongside scoring of the same series</li>
 * <li>log lines: {@code logs|service}</li>
 * <li>SLO ticks: {@code slo|id}</li>
 * </ul>
 * <p>
 * Scoring and mining run on the ingest pool, which never touches storage.
 * Appends are handed to the writer pool and recomputes and ticks run on the
 * periodic pool, so a slow store delays only storage work, never the
 * scoring of another key.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A failed history read keeps the previous baseline and flags it stale. A
 * failed SLO count read skips the tick and republishes the last status
 * flagged stale. Neither affects any other key.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsEngine.class);

    private final AnalyticsConfig config;
    private final MetricStore store;
    private final AnalyticsSink sink;
    private final Clock clock;

    private final BaselineRegistry registry = new BaselineRegistry();
    private final SeasonalBaselineEstimator estimator;
    private final AnomalyDetector detector;
    private final LogTemplateMiner miner;
    private final SloEvaluator sloEvaluator;

    private final KeyedWorkerPool pool;
    private final KeyedWorkerPool writers;
    private final KeyedWorkerPool periodic;
    private final StorageCallGuard guard;
    private final LatestTickGate ticks = new LatestTickGate();
    private final Set<SeriesKey> knownSeries = ConcurrentHashMap.newKeySet();

    private final AtomicLong samplesProcessed = new AtomicLong();
    private final AtomicLong logsProcessed = new AtomicLong();
    private final AtomicLong anomaliesEmitted = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicLong failedRecomputes = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public AnalyticsEngine(AnalyticsConfig config, MetricStore store, AnalyticsSink sink) {
        this(config, store, sink, Clock.systemUTC());
    }

    public AnalyticsEngine(AnalyticsConfig config, MetricStore store, AnalyticsSink sink, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.estimator = new SeasonalBaselineEstimator(config.getBaseline(), registry);
        this.detector = new AnomalyDetector(config, registry, HolidayCalendar.from(config.getBaseline()));
        this.miner = new LogTemplateMiner(config.getLogMining());
        this.sloEvaluator = new SloEvaluator(config);
        int workers = config.getRuntime().effectiveWorkers();
        int capacity = config.getRuntime().getQueueCapacity();
        this.pool = new KeyedWorkerPool("ingest", workers, capacity);
        this.writers = new KeyedWorkerPool("writer", workers, capacity);
        this.periodic = new KeyedWorkerPool("periodic", workers, capacity);
        this.guard = new StorageCallGuard(config.getRuntime());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start periodic baseline recompute and SLO ticks.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pulsewatch-scheduler");
            t.setDaemon(true);
            return t;
        });
        long recompute = config.getBaseline().recomputeInterval().toMillis();
        long tick = config.getSlo().tick().toMillis();
        scheduler.scheduleAtFixedRate(() -> recomputeAll(clock.instant()), recompute, recompute,
                TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(() -> tickAll(clock.instant()), tick, tick, TimeUnit.MILLISECONDS);
        LOG.info("Analytics engine started: recompute every {} ms, SLO tick every {} ms, {} SLO(s)",
                recompute, tick, sloEvaluator.definitions().size());
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        pool.close();
        periodic.close();
        writers.close();
        guard.close();
        LOG.info("Analytics engine stopped: samples={}, logs={}, anomalies={}, skippedTicks={}",
                samplesProcessed.get(), logsProcessed.get(), anomaliesEmitted.get(), skippedTicks.get());
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Queue a sample for scoring; it is stored asynchronously.
     */
    public boolean submitSample(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        SeriesKey key = sample.seriesKey();
        knownSeries.add(key);
        return pool.submit("metric|" + key, () -> processSample(sample));
    }

    /**
     * Hand the sample to the writer pool and score it on the calling thread.
     *
     * @return the anomaly raised by the sample, if any
     */
    Optional<AnomalyEvent> processSample(MetricSample sample) {
        writers.submit("metric|" + sample.seriesKey(), () -> persist("appendSample " + sample.seriesKey(),
                () -> store.appendSample(sample)));
        samplesProcessed.incrementAndGet();
        Optional<AnomalyEvent> event = detector.score(sample);
        event.ifPresent(this::emitAnomaly);
        return event;
    }

    public boolean submitLog(LogRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return pool.submit("logs|" + record.getService(), () -> processLog(record));
    }

    IngestResult processLog(LogRecord record) {
        writers.submit("logs|" + record.getService(), () -> persist("appendLog " + record.getService(),
                () -> store.appendLog(record)));
        IngestResult result = miner.ingest(record);
        logsProcessed.incrementAndGet();
        sink.onTemplate(result.template());
        sink.onOccurrence(result.occurrence());
        result.anomaly().ifPresent(this::emitAnomaly);
        return result;
    }

    private void persist(String operation, Runnable append) {
        try {
            guard.call(operation, () -> {
                append.run();
                return null;
            });
        } catch (StorageUnavailableException e) {
            LOG.warn("{} not stored: {}", operation, e.getMessage());
        }
    }

    private void emitAnomaly(AnomalyEvent event) {
        anomaliesEmitted.incrementAndGet();
        LOG.debug("Anomaly {} on {}/{} severity={} score={}", event.getMethod().label(), event.getService(),
                event.getMetricOrPattern(), event.getSeverity(), event.getScore());
        sink.onAnomaly(event);
    }

    // ---------------------------------------------------------------
    // Baseline recompute
    // ---------------------------------------------------------------

    /**
     * Queue a recompute of every series seen so far.
     */
    public void recomputeAll(Instant now) {
        for (SeriesKey key : knownSeries) {
            periodic.submit("baseline|" + key, () -> recomputeBaseline(key.service(), key.metricName(), now));
        }
    }

    /**
     * Recompute and publish one series baseline from the lookback window.
     *
     * @return the new baseline, or empty when history could not be read and
     *         the previous baseline was kept as stale
     */
    public Optional<SeasonalBaseline> recomputeBaseline(String service, String metric, Instant now) {
        SeriesKey key = new SeriesKey(service, metric);
        String tickKey = "baseline|" + key;
        long ticket = ticks.begin(tickKey);
        Instant from = now.minus(config.getBaseline().lookback());
        List<MetricSample> history;
        try {
            history = guard.call("querySamples " + key, () -> store.querySamples(service, metric, from, now));
        } catch (StorageUnavailableException e) {
            failedRecomputes.incrementAndGet();
            registry.markStale(key);
            LOG.warn("Baseline recompute for {} skipped, keeping previous baseline: {}", key, e.getMessage());
            return Optional.empty();
        }
        SeasonalBaseline computed = estimator.compute(service, metric, history, now);
        if (!ticks.tryPublish(tickKey, ticket)) {
            LOG.debug("Baseline recompute for {} at {} overtaken, result discarded", key, now);
            return Optional.empty();
        }
        registry.publish(computed);
        LOG.info("Baseline for {} recomputed from {} samples, dominant={}", key, history.size(),
                computed.getDominantPeriod().label());
        return Optional.of(computed);
    }

    // ---------------------------------------------------------------
    // SLO ticks
    // ---------------------------------------------------------------

    public void tickAll(Instant now) {
        for (SloDefinition def : sloEvaluator.definitions()) {
            periodic.submit("slo|" + def.getId(), () -> tickSlo(def.getId(), now));
        }
    }

    /**
     * Evaluate one tick of one SLO from the samples of the tick interval.
     *
     * @return the evaluation, or empty when the tick was skipped or overtaken
     */
    public Optional<SloEvaluation> tickSlo(String sloId, Instant now) {
        SloDefinition def = sloEvaluator.definition(sloId);
        String tickKey = "slo|" + sloId;
        long ticket = ticks.begin(tickKey);
        Duration tick = config.getSlo().tick();
        List<MetricSample> samples;
        try {
            samples = guard.call("querySamples slo " + sloId,
                    () -> store.querySamples(def.getService(), def.getMetricName(), now.minus(tick), now));
        } catch (StorageUnavailableException e) {
            skippedTicks.incrementAndGet();
            SloStatus stale = sloEvaluator.markStale(sloId, now);
            LOG.warn("SLO {} tick at {} skipped: {}", sloId, now, e.getMessage());
            sink.onStatus(stale);
            return Optional.empty();
        }
        long[] counts = SliClassifier.classify(def, samples);
        // counts belong to the bucket of the interval start
        SloEvaluator.PendingEvaluation pending = sloEvaluator.prepare(sloId, counts[0], counts[1],
                now.minus(tick));
        if (!ticks.tryPublish(tickKey, ticket) || !sloEvaluator.commit(pending)) {
            LOG.debug("SLO {} tick at {} overtaken, result discarded", sloId, now);
            return Optional.empty();
        }
        SloEvaluation evaluation = pending.evaluation();
        sink.onMeasurement(evaluation.measurement());
        sink.onStatus(evaluation.status());
        return Optional.of(evaluation);
    }

    // ---------------------------------------------------------------
    // Accessors and counters
    // ---------------------------------------------------------------

    /**
     * Wait until all three pools are idle.
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (KeyedWorkerPool p : List.of(pool, periodic, writers)) {
            if (!p.awaitIdle(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())))) {
                return false;
            }
        }
        return true;
    }

    public BaselineRegistry baselines() {
        return registry;
    }

    public LogTemplateMiner miner() {
        return miner;
    }

    public SloEvaluator sloEvaluator() {
        return sloEvaluator;
    }

    public long droppedTasks() {
        return pool.droppedTasks() + periodic.droppedTasks();
    }

    /**
     * @return appends dropped because the writer queues were full
     */
    public long droppedWrites() {
        return writers.droppedTasks();
    }

    public long failedTasks() {
        return pool.failedTasks() + periodic.failedTasks() + writers.failedTasks();
    }

    public long templateEvictions() {
        return miner.totalEvictions();
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    public long discardedTicks() {
        return ticks.discardedTicks();
    }

    public long failedRecomputes() {
        return failedRecomputes.get();
    }

    public long staleBaselines() {
        return registry.staleCount();
    }

    public long samplesProcessed() {
        return samplesProcessed.get();
    }

    public long logsProcessed() {
        return logsProcessed.get();
    }

    public long anomaliesEmitted() {
        return anomaliesEmitted.get();
    }
}
