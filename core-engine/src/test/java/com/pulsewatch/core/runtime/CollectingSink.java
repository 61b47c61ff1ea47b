package com.pulsewatch.core.runtime;

import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.LogPatternOccurrence;
import com.pulsewatch.core.model.LogTemplate;
import com.pulsewatch.core.model.SloMeasurement;
import com.pulsewatch.core.model.SloStatus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link AnalyticsSink} that keeps everything it receives.
 */
class CollectingSink implements AnalyticsSink {

    final List<AnomalyEvent> anomalies = new CopyOnWriteArrayList<>();
    final List<LogTemplate> templates = new CopyOnWriteArrayList<>();
    final List<LogPatternOccurrence> occurrences = new CopyOnWriteArrayList<>();
    final List<SloMeasurement> measurements = new CopyOnWriteArrayList<>();
    final List<SloStatus> statuses = new CopyOnWriteArrayList<>();

    @Override
    public void onAnomaly(AnomalyEvent event) {
        anomalies.add(event);
    }

    @Override
    public void onTemplate(LogTemplate template) {
        templates.add(template);
    }

    @Override
    public void onOccurrence(LogPatternOccurrence occurrence) {
        occurrences.add(occurrence);
    }

    @Override
    public void onMeasurement(SloMeasurement measurement) {
        measurements.add(measurement);
    }

    @Override
    public void onStatus(SloStatus status) {
        statuses.add(status);
    }
}
