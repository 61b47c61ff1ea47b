package com.pulsewatch.core.model;

import com.pulsewatch.core.error.InvalidConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A service level objective loaded from configuration.
 *
 * <p>
 * Read-only to the evaluator. Call {@link #validate()} after
 * deserialization; an invalid definition is excluded from evaluation.
 * </p>
 *
 * <h3>Example</h3>
 *
 * <pre>
 * - id: checkout-latency
 *   service: checkout
 *   metricName: http.server.duration
 *   sliType: latency
 *   threshold: 300
 *   operator: lt
 *   targetPercentage: 99.9
 *   windowDays: 30
 * </pre>
 *
 * @since 1.0.0
 */
public class SloDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_BURN_RATE_FAST = 14.4;
    public static final double DEFAULT_BURN_RATE_SLOW = 6.0;

    private String id;
    private String service;

    /** Metric whose samples are classified good/bad by {@link #operator}. */
    private String metricName;

    /** One of latency, error_rate, availability, throughput. */
    private String sliType;

    private double threshold;

    /** One of lt, lte, gt, gte. */
    private String operator;

    private double targetPercentage;
    private int windowDays = 30;
    private double burnRateFast = DEFAULT_BURN_RATE_FAST;
    private double burnRateSlow = DEFAULT_BURN_RATE_SLOW;

    public SloDefinition() {
    }

    public SloDefinition(String id, String service, String metricName, String sliType,
            double threshold, String operator, double targetPercentage, int windowDays) {
        setId(id);
        setService(service);
        setMetricName(metricName);
        setSliType(sliType);
        setThreshold(threshold);
        setOperator(operator);
        setTargetPercentage(targetPercentage);
        setWindowDays(windowDays);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields are present and within range.
     *
     * @throws InvalidConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("SLO 'id' is required");
        }
        if (service == null || service.isBlank()) {
            errors.add("SLO '" + id + "' requires 'service'");
        }
        try {
            SliType.fromLabel(sliType);
        } catch (IllegalArgumentException e) {
            errors.add("SLO '" + id + "': " + e.getMessage());
        }
        try {
            SliOperator.fromLabel(operator);
        } catch (IllegalArgumentException e) {
            errors.add("SLO '" + id + "': " + e.getMessage());
        }
        if (Double.isNaN(threshold) || Double.isInfinite(threshold)) {
            errors.add("SLO '" + id + "' requires a finite 'threshold'");
        }
        if (!(targetPercentage > 0 && targetPercentage < 100)) {
            errors.add("SLO '" + id + "' requires 0 < 'targetPercentage' < 100, got: " + targetPercentage);
        }
        if (windowDays < 1 || windowDays > 90) {
            errors.add("SLO '" + id + "' requires 1 <= 'windowDays' <= 90, got: " + windowDays);
        }
        if (!(burnRateFast > 0)) {
            errors.add("SLO '" + id + "' requires 'burnRateFast' > 0");
        }
        if (!(burnRateSlow > 0)) {
            errors.add("SLO '" + id + "' requires 'burnRateSlow' > 0");
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Invalid SloDefinition: " + String.join("; ", errors));
        }
    }

    /**
     * @return allowed bad fraction, {@code 1 - targetPercentage/100}
     */
    public double errorBudgetFraction() {
        return 1.0 - targetPercentage / 100.0;
    }

    public SliType sliKind() {
        return SliType.fromLabel(sliType);
    }

    public SliOperator comparison() {
        return SliOperator.fromLabel(operator);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public String getSliType() {
        return sliType;
    }

    public void setSliType(String sliType) {
        this.sliType = sliType != null ? sliType.toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator != null ? operator.toLowerCase(Locale.ROOT) : null;
    }

    public double getTargetPercentage() {
        return targetPercentage;
    }

    public void setTargetPercentage(double targetPercentage) {
        this.targetPercentage = targetPercentage;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public double getBurnRateFast() {
        return burnRateFast;
    }

    public void setBurnRateFast(double burnRateFast) {
        this.burnRateFast = burnRateFast;
    }

    public double getBurnRateSlow() {
        return burnRateSlow;
    }

    public void setBurnRateSlow(double burnRateSlow) {
        this.burnRateSlow = burnRateSlow;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloDefinition that))
            return false;
        return Double.compare(that.threshold, threshold) == 0
                && Double.compare(that.targetPercentage, targetPercentage) == 0
                && windowDays == that.windowDays
                && Double.compare(that.burnRateFast, burnRateFast) == 0
                && Double.compare(that.burnRateSlow, burnRateSlow) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(service, that.service)
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(sliType, that.sliType)
                && Objects.equals(operator, that.operator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, service, metricName, sliType, threshold, operator,
                targetPercentage, windowDays, burnRateFast, burnRateSlow);
    }

    @Override
    public String toString() {
        return "SloDefinition{" +
                "id='" + id + '\'' +
                ", service='" + service + '\'' +
                ", sliType='" + sliType + '\'' +
                ", " + operator + " " + threshold +
                ", target=" + targetPercentage + "%" +
                ", windowDays=" + windowDays +
                '}';
    }
}
