package com.pulsewatch.core.config;

import com.pulsewatch.core.error.InvalidConfigurationException;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Metric anomaly detection settings ({@code detection:} section).
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String mode = ScoringMode.COMBINED.name();
    private double warningSigma = 3.0;
    private double criticalSigma = 4.0;

    /** Start of the rolling z-score window, relative to the scored sample. */
    private int trailingWindowMinutes = 60;

    /** Most recent interval left out of the z-score window. */
    private int exclusionMinutes = 5;

    /** Maximum samples retained per series; the oldest is evicted on overflow. */
    private int windowCapacity = 720;

    /** Samples required in the window before a z-score is computed. */
    private int minWindowSamples = 10;

    private List<MetricPolicy> metrics = new ArrayList<>();

    public List<String> problems() {
        List<String> errors = new ArrayList<>();
        try {
            ScoringMode.parse(mode);
        } catch (IllegalArgumentException e) {
            errors.add("detection.mode: " + e.getMessage());
        }
        if (!(warningSigma > 0) || criticalSigma < warningSigma) {
            errors.add("detection requires 0 < warningSigma <= criticalSigma");
        }
        if (trailingWindowMinutes <= exclusionMinutes || exclusionMinutes < 0) {
            errors.add("detection requires 0 <= exclusionMinutes < trailingWindowMinutes");
        }
        if (windowCapacity < 2) {
            errors.add("detection.windowCapacity must be >= 2");
        }
        if (minWindowSamples < 2) {
            errors.add("detection.minWindowSamples must be >= 2");
        }
        return errors;
    }

    /**
     * Drop every invalid metric policy.
     *
     * @return one message per rejected policy
     */
    List<String> pruneInvalidPolicies() {
        List<String> rejected = new ArrayList<>();
        Iterator<MetricPolicy> it = metrics.iterator();
        while (it.hasNext()) {
            MetricPolicy policy = it.next();
            if (policy == null) {
                it.remove();
                continue;
            }
            try {
                policy.validate();
            } catch (InvalidConfigurationException e) {
                rejected.add(e.getMessage());
                it.remove();
            }
        }
        return rejected;
    }

    /**
     * Resolve the settings for one series. An override naming the service
     * exactly wins over a {@code *} override; unset fields inherit the
     * section defaults.
     *
     * @param service service name
     * @param metric  metric name
     * @return effective thresholds
     */
    public DetectionThresholds thresholdsFor(String service, String metric) {
        MetricPolicy best = null;
        for (MetricPolicy p : metrics) {
            if (p.matches(service, metric)) {
                if (best == null || MetricPolicy.ANY_SERVICE.equals(best.getService())) {
                    best = p;
                }
            }
        }
        ScoringMode defaultMode = ScoringMode.parse(mode);
        if (best == null) {
            return new DetectionThresholds(defaultMode, warningSigma, criticalSigma);
        }
        return new DetectionThresholds(
                best.getMode() != null ? ScoringMode.parse(best.getMode()) : defaultMode,
                best.getWarningSigma() != null ? best.getWarningSigma() : warningSigma,
                best.getCriticalSigma() != null ? best.getCriticalSigma() : criticalSigma);
    }

    public Duration trailingWindow() {
        return Duration.ofMinutes(trailingWindowMinutes);
    }

    public Duration exclusion() {
        return Duration.ofMinutes(exclusionMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public double getWarningSigma() {
        return warningSigma;
    }

    public void setWarningSigma(double warningSigma) {
        this.warningSigma = warningSigma;
    }

    public double getCriticalSigma() {
        return criticalSigma;
    }

    public void setCriticalSigma(double criticalSigma) {
        this.criticalSigma = criticalSigma;
    }

    public int getTrailingWindowMinutes() {
        return trailingWindowMinutes;
    }

    public void setTrailingWindowMinutes(int trailingWindowMinutes) {
        this.trailingWindowMinutes = trailingWindowMinutes;
    }

    public int getExclusionMinutes() {
        return exclusionMinutes;
    }

    public void setExclusionMinutes(int exclusionMinutes) {
        this.exclusionMinutes = exclusionMinutes;
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public void setWindowCapacity(int windowCapacity) {
        this.windowCapacity = windowCapacity;
    }

    public int getMinWindowSamples() {
        return minWindowSamples;
    }

    public void setMinWindowSamples(int minWindowSamples) {
        this.minWindowSamples = minWindowSamples;
    }

    public List<MetricPolicy> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<MetricPolicy> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }
}
