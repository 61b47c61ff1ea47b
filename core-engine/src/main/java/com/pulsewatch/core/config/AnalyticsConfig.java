package com.pulsewatch.core.config;

import com.pulsewatch.core.error.InvalidConfigurationException;
import com.pulsewatch.core.model.SloDefinition;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the analytics YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section optional, defaults apply):
 * </p>
 *
 * <pre>
 * baseline:
 *   lookbackDays: 56
 * detection:
 *   mode: combined
 *   metrics:
 *     - service: "*"
 *       metric: cpu.usage
 *       mode: zscore
 * logMining:
 *   mergeThreshold: 0.6
 * slo:
 *   hysteresisTicks: 3
 * slos:
 *   - id: checkout-availability
 *     ...
 * runtime:
 *   queueCapacity: 10000
 * </pre>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link #validate()} rejects the whole configuration when a global section
 * is invalid. {@link #pruneInvalid()} removes individual SLO definitions and
 * metric policies that are malformed, so one bad entry never disables the
 * rest.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private BaselineSettings baseline = new BaselineSettings();
    private DetectionSettings detection = new DetectionSettings();
    private LogMiningSettings logMining = new LogMiningSettings();
    private SloSettings slo = new SloSettings();
    private List<SloDefinition> slos = new ArrayList<>();
    private RuntimeSettings runtime = new RuntimeSettings();

    /**
     * Validate the global sections.
     *
     * @throws InvalidConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        errors.addAll(baseline.problems());
        errors.addAll(detection.problems());
        errors.addAll(logMining.problems());
        errors.addAll(slo.problems());
        errors.addAll(runtime.problems());

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Analytics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Remove malformed SLO definitions (including duplicate ids) and metric
     * policies.
     *
     * @return one message per excluded entry
     */
    public List<String> pruneInvalid() {
        List<String> rejected = new ArrayList<>(detection.pruneInvalidPolicies());
        Set<String> seen = new HashSet<>();
        Iterator<SloDefinition> it = slos.iterator();
        int index = 0;
        while (it.hasNext()) {
            SloDefinition def = it.next();
            if (def == null) {
                rejected.add("SLO at index " + index + " is null");
                it.remove();
            } else {
                try {
                    def.validate();
                    if (!seen.add(def.getId())) {
                        rejected.add("Duplicate SLO id '" + def.getId() + "'");
                        it.remove();
                    }
                } catch (InvalidConfigurationException e) {
                    rejected.add(e.getMessage());
                    it.remove();
                }
            }
            index++;
        }
        return rejected;
    }

    public Optional<SloDefinition> findSlo(String id) {
        return slos.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public LogMiningSettings getLogMining() {
        return logMining;
    }

    public void setLogMining(LogMiningSettings logMining) {
        this.logMining = logMining != null ? logMining : new LogMiningSettings();
    }

    public SloSettings getSlo() {
        return slo;
    }

    public void setSlo(SloSettings slo) {
        this.slo = slo != null ? slo : new SloSettings();
    }

    /**
     * @return unmodifiable list of SLO definitions
     */
    public List<SloDefinition> getSlos() {
        return Collections.unmodifiableList(slos);
    }

    public void setSlos(List<SloDefinition> slos) {
        this.slos = slos != null ? new ArrayList<>(slos) : new ArrayList<>();
    }

    public RuntimeSettings getRuntime() {
        return runtime;
    }

    public void setRuntime(RuntimeSettings runtime) {
        this.runtime = runtime != null ? runtime : new RuntimeSettings();
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{slos=" + slos.size()
                + ", metricPolicies=" + detection.getMetrics().size()
                + ", mode=" + detection.getMode() + '}';
    }
}
