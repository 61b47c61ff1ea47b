package com.pulsewatch.core.config;

import com.pulsewatch.core.error.InvalidConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-metric override of the detection defaults.
 *
 * <p>
 * {@code service} may be {@value #ANY_SERVICE} to match the metric on every
 * service. Unset fields inherit from {@link DetectionSettings}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricPolicy implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ANY_SERVICE = "*";

    private String service = ANY_SERVICE;
    private String metric;
    private String mode;
    private Double warningSigma;
    private Double criticalSigma;

    /**
     * @throws InvalidConfigurationException if the policy is malformed
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (service == null || service.isBlank()) {
            errors.add("'service' is required (use '*' for any)");
        }
        if (metric == null || metric.isBlank()) {
            errors.add("'metric' is required");
        }
        if (mode != null) {
            try {
                ScoringMode.parse(mode);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (warningSigma != null && !(warningSigma > 0)) {
            errors.add("'warningSigma' must be > 0");
        }
        if (criticalSigma != null && !(criticalSigma > 0)) {
            errors.add("'criticalSigma' must be > 0");
        }
        if (warningSigma != null && criticalSigma != null && criticalSigma < warningSigma) {
            errors.add("'criticalSigma' must be >= 'warningSigma'");
        }
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException("Invalid metric policy " + service + "|" + metric
                    + ": " + String.join("; ", errors));
        }
    }

    boolean matches(String service, String metric) {
        return this.metric.equals(metric)
                && (ANY_SERVICE.equals(this.service) || this.service.equals(service));
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Double getWarningSigma() {
        return warningSigma;
    }

    public void setWarningSigma(Double warningSigma) {
        this.warningSigma = warningSigma;
    }

    public Double getCriticalSigma() {
        return criticalSigma;
    }

    public void setCriticalSigma(Double criticalSigma) {
        this.criticalSigma = criticalSigma;
    }

    @Override
    public String toString() {
        return "MetricPolicy{" + service + "|" + metric + ", mode=" + mode
                + ", warn=" + warningSigma + ", crit=" + criticalSigma + '}';
    }
}
