package com.pulsewatch.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Log template mining settings ({@code logMining:} section).
 *
 * @since 1.0.0
 */
public class LogMiningSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Minimum positional similarity for a line to merge into a template. */
    private double mergeThreshold = 0.6;

    /** Templates kept per service before the least recently seen is evicted. */
    private int templateCap = 1000;

    /** Sample lines retained per template. */
    private int sampleCapacity = 5;

    /** Replace IPs, UUIDs, numbers and similar with typed placeholders before tokenizing. */
    private boolean maskVariables = false;

    /** A template stays rare while its count is at or below this value. */
    private int rareThreshold = 5;

    private double spikeSigma = 4.0;
    private double transitionSigma = 4.0;

    /** Per-minute rate history kept per template. */
    private int rateHistoryMinutes = 60;

    private int minRateHistoryMinutes = 10;

    /** Floor applied to the per-minute rate std. */
    private double minRateStd = 1.0;

    private int minGapSamples = 10;

    /** Floor applied to the inter-arrival std, as a fraction of the mean gap. */
    private double minGapStdFraction = 0.1;

    /** A completed minute this many std below the mean rate is a drop. */
    private double dropSigma = 3.0;

    /** Drops are only reported for templates averaging at least this many lines per minute. */
    private double minDropExpected = 5.0;

    /** Longest gap between two lines of a session that still counts as a transition. */
    private long sessionWindowSeconds = 60;

    /** Transitions out of a template needed before its successors are judged. */
    private int minTransitionCount = 10;

    private double lowTransitionProbability = 0.01;

    /** Sessions remembered per service. */
    private int sessionCap = 10_000;

    private List<ServiceMiningOverride> services = new ArrayList<>();

    public List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (!(mergeThreshold > 0 && mergeThreshold <= 1)) {
            errors.add("logMining.mergeThreshold must be in (0, 1]");
        }
        if (templateCap < 1) {
            errors.add("logMining.templateCap must be >= 1");
        }
        if (sampleCapacity < 1) {
            errors.add("logMining.sampleCapacity must be >= 1");
        }
        if (rareThreshold < 0) {
            errors.add("logMining.rareThreshold must be >= 0");
        }
        if (!(spikeSigma > 0) || !(transitionSigma > 0)) {
            errors.add("logMining.spikeSigma and transitionSigma must be > 0");
        }
        if (rateHistoryMinutes < 2 || minRateHistoryMinutes < 1 || minRateHistoryMinutes > rateHistoryMinutes) {
            errors.add("logMining requires 1 <= minRateHistoryMinutes <= rateHistoryMinutes, rateHistoryMinutes >= 2");
        }
        if (minRateStd < 0 || minGapStdFraction < 0) {
            errors.add("logMining.minRateStd and minGapStdFraction must be >= 0");
        }
        if (!(dropSigma > 0) || minDropExpected < 0) {
            errors.add("logMining.dropSigma must be > 0 and minDropExpected >= 0");
        }
        if (sessionWindowSeconds < 1 || minTransitionCount < 1 || sessionCap < 1) {
            errors.add("logMining.sessionWindowSeconds, minTransitionCount and sessionCap must be >= 1");
        }
        if (!(lowTransitionProbability > 0 && lowTransitionProbability < 1)) {
            errors.add("logMining.lowTransitionProbability must be in (0, 1)");
        }
        if (minGapSamples < 2) {
            errors.add("logMining.minGapSamples must be >= 2");
        }
        for (ServiceMiningOverride o : services) {
            if (o == null || o.getService() == null || o.getService().isBlank()) {
                errors.add("logMining.services entries require 'service'");
                continue;
            }
            if (o.getMergeThreshold() != null && !(o.getMergeThreshold() > 0 && o.getMergeThreshold() <= 1)) {
                errors.add("logMining.services[" + o.getService() + "].mergeThreshold must be in (0, 1]");
            }
            if (o.getTemplateCap() != null && o.getTemplateCap() < 1) {
                errors.add("logMining.services[" + o.getService() + "].templateCap must be >= 1");
            }
        }
        return errors;
    }

    public double mergeThresholdFor(String service) {
        ServiceMiningOverride o = overrideFor(service);
        return o != null && o.getMergeThreshold() != null ? o.getMergeThreshold() : mergeThreshold;
    }

    public int templateCapFor(String service) {
        ServiceMiningOverride o = overrideFor(service);
        return o != null && o.getTemplateCap() != null ? o.getTemplateCap() : templateCap;
    }

    private ServiceMiningOverride overrideFor(String service) {
        for (ServiceMiningOverride o : services) {
            if (o.getService().equals(service)) {
                return o;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getMergeThreshold() {
        return mergeThreshold;
    }

    public void setMergeThreshold(double mergeThreshold) {
        this.mergeThreshold = mergeThreshold;
    }

    public int getTemplateCap() {
        return templateCap;
    }

    public void setTemplateCap(int templateCap) {
        this.templateCap = templateCap;
    }

    public int getSampleCapacity() {
        return sampleCapacity;
    }

    public void setSampleCapacity(int sampleCapacity) {
        this.sampleCapacity = sampleCapacity;
    }

    public boolean isMaskVariables() {
        return maskVariables;
    }

    public void setMaskVariables(boolean maskVariables) {
        this.maskVariables = maskVariables;
    }

    public int getRareThreshold() {
        return rareThreshold;
    }

    public void setRareThreshold(int rareThreshold) {
        this.rareThreshold = rareThreshold;
    }

    public double getSpikeSigma() {
        return spikeSigma;
    }

    public void setSpikeSigma(double spikeSigma) {
        this.spikeSigma = spikeSigma;
    }

    public double getTransitionSigma() {
        return transitionSigma;
    }

    public void setTransitionSigma(double transitionSigma) {
        this.transitionSigma = transitionSigma;
    }

    public int getRateHistoryMinutes() {
        return rateHistoryMinutes;
    }

    public void setRateHistoryMinutes(int rateHistoryMinutes) {
        this.rateHistoryMinutes = rateHistoryMinutes;
    }

    public int getMinRateHistoryMinutes() {
        return minRateHistoryMinutes;
    }

    public void setMinRateHistoryMinutes(int minRateHistoryMinutes) {
        this.minRateHistoryMinutes = minRateHistoryMinutes;
    }

    public double getMinRateStd() {
        return minRateStd;
    }

    public void setMinRateStd(double minRateStd) {
        this.minRateStd = minRateStd;
    }

    public int getMinGapSamples() {
        return minGapSamples;
    }

    public void setMinGapSamples(int minGapSamples) {
        this.minGapSamples = minGapSamples;
    }

    public double getMinGapStdFraction() {
        return minGapStdFraction;
    }

    public void setMinGapStdFraction(double minGapStdFraction) {
        this.minGapStdFraction = minGapStdFraction;
    }

    public double getDropSigma() {
        return dropSigma;
    }

    public void setDropSigma(double dropSigma) {
        this.dropSigma = dropSigma;
    }

    public double getMinDropExpected() {
        return minDropExpected;
    }

    public void setMinDropExpected(double minDropExpected) {
        this.minDropExpected = minDropExpected;
    }

    public long getSessionWindowSeconds() {
        return sessionWindowSeconds;
    }

    public void setSessionWindowSeconds(long sessionWindowSeconds) {
        this.sessionWindowSeconds = sessionWindowSeconds;
    }

    public int getMinTransitionCount() {
        return minTransitionCount;
    }

    public void setMinTransitionCount(int minTransitionCount) {
        this.minTransitionCount = minTransitionCount;
    }

    public double getLowTransitionProbability() {
        return lowTransitionProbability;
    }

    public void setLowTransitionProbability(double lowTransitionProbability) {
        this.lowTransitionProbability = lowTransitionProbability;
    }

    public int getSessionCap() {
        return sessionCap;
    }

    public void setSessionCap(int sessionCap) {
        this.sessionCap = sessionCap;
    }

    public List<ServiceMiningOverride> getServices() {
        return services;
    }

    public void setServices(List<ServiceMiningOverride> services) {
        this.services = services != null ? new ArrayList<>(services) : new ArrayList<>();
    }
}
