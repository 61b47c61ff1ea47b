package com.pulsewatch.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Seasonal baseline estimation settings ({@code baseline:} section).
 *
 * @since 1.0.0
 */
public class BaselineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    static final DateTimeFormatter HOLIDAY_FORMAT = DateTimeFormatter.ofPattern("MM-dd");

    /** History fetched for each recompute. */
    private int lookbackDays = 56;

    private int recomputeIntervalMinutes = 60;

    /** Buckets with fewer samples fall back to global statistics. */
    private int minBucketSamples = 5;

    /** Seasonality strength above which a granularity counts as a pattern. */
    private double strengthThreshold = 0.3;

    /**
     * Margin of adjusted strength a longer period needs over the current
     * dominant one to take its place.
     */
    private double dominanceMargin = 0.02;

    /** Confidence of a global-fallback lookup is capped at {@code 1 - penalty}. */
    private double lowConfidencePenalty = 0.5;

    /** Bucket sample count at which confidence reaches 1. */
    private int fullConfidenceSamples = 30;

    private String zoneId = "UTC";

    /** Fixed holidays as {@code MM-dd}. */
    private List<String> holidays = new ArrayList<>();

    private double holidayLeniency = 1.0;
    private double weekendLeniency = 1.0;

    /**
     * @return the problems found, empty when valid
     */
    public List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (lookbackDays < 1) {
            errors.add("baseline.lookbackDays must be >= 1");
        }
        if (recomputeIntervalMinutes < 1) {
            errors.add("baseline.recomputeIntervalMinutes must be >= 1");
        }
        if (minBucketSamples < 1) {
            errors.add("baseline.minBucketSamples must be >= 1");
        }
        if (!(strengthThreshold >= 0 && strengthThreshold < 1)) {
            errors.add("baseline.strengthThreshold must be in [0, 1)");
        }
        if (!(dominanceMargin >= 0 && dominanceMargin < 1)) {
            errors.add("baseline.dominanceMargin must be in [0, 1)");
        }
        if (!(lowConfidencePenalty >= 0 && lowConfidencePenalty <= 1)) {
            errors.add("baseline.lowConfidencePenalty must be in [0, 1]");
        }
        if (fullConfidenceSamples < 1) {
            errors.add("baseline.fullConfidenceSamples must be >= 1");
        }
        try {
            ZoneId.of(zoneId);
        } catch (DateTimeException | NullPointerException e) {
            errors.add("baseline.zoneId is not a valid zone: " + zoneId);
        }
        for (String h : holidays) {
            try {
                MonthDay.parse(h, HOLIDAY_FORMAT);
            } catch (DateTimeParseException | NullPointerException e) {
                errors.add("baseline.holidays entry is not MM-dd: " + h);
            }
        }
        if (holidayLeniency < 1 || weekendLeniency < 1) {
            errors.add("baseline.holidayLeniency and weekendLeniency must be >= 1");
        }
        return errors;
    }

    public Duration lookback() {
        return Duration.ofDays(lookbackDays);
    }

    public Duration recomputeInterval() {
        return Duration.ofMinutes(recomputeIntervalMinutes);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    public List<MonthDay> holidayDates() {
        return holidays.stream().map(h -> MonthDay.parse(h, HOLIDAY_FORMAT)).toList();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public int getRecomputeIntervalMinutes() {
        return recomputeIntervalMinutes;
    }

    public void setRecomputeIntervalMinutes(int recomputeIntervalMinutes) {
        this.recomputeIntervalMinutes = recomputeIntervalMinutes;
    }

    public int getMinBucketSamples() {
        return minBucketSamples;
    }

    public void setMinBucketSamples(int minBucketSamples) {
        this.minBucketSamples = minBucketSamples;
    }

    public double getStrengthThreshold() {
        return strengthThreshold;
    }

    public void setStrengthThreshold(double strengthThreshold) {
        this.strengthThreshold = strengthThreshold;
    }

    public double getDominanceMargin() {
        return dominanceMargin;
    }

    public void setDominanceMargin(double dominanceMargin) {
        this.dominanceMargin = dominanceMargin;
    }

    public double getLowConfidencePenalty() {
        return lowConfidencePenalty;
    }

    public void setLowConfidencePenalty(double lowConfidencePenalty) {
        this.lowConfidencePenalty = lowConfidencePenalty;
    }

    public int getFullConfidenceSamples() {
        return fullConfidenceSamples;
    }

    public void setFullConfidenceSamples(int fullConfidenceSamples) {
        this.fullConfidenceSamples = fullConfidenceSamples;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public List<String> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<String> holidays) {
        this.holidays = holidays != null ? new ArrayList<>(holidays) : new ArrayList<>();
    }

    public double getHolidayLeniency() {
        return holidayLeniency;
    }

    public void setHolidayLeniency(double holidayLeniency) {
        this.holidayLeniency = holidayLeniency;
    }

    public double getWeekendLeniency() {
        return weekendLeniency;
    }

    public void setWeekendLeniency(double weekendLeniency) {
        this.weekendLeniency = weekendLeniency;
    }
}
