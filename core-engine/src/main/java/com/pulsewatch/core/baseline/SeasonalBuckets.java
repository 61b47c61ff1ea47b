package com.pulsewatch.core.baseline;

import com.pulsewatch.core.model.SeasonalPeriod;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Maps instants onto seasonal bucket indices. Day of week counts from
 * Monday = 0.
 *
 * @since 1.0.0
 */
public final class SeasonalBuckets {

    private SeasonalBuckets() {
    }

    public static int bucket(SeasonalPeriod period, Instant timestamp, ZoneId zone) {
        return bucket(period, timestamp.atZone(zone));
    }

    public static int bucket(SeasonalPeriod period, ZonedDateTime time) {
        int hour = time.getHour();
        int day = time.getDayOfWeek().getValue() - 1;
        return switch (period) {
            case HOURLY -> hour;
            case DAILY -> day;
            case WEEKLY -> day * 24 + hour;
            case NONE -> throw new IllegalArgumentException("NONE has no buckets");
        };
    }

    /**
     * @return a label such as {@code hour 14:00}, {@code Tuesday} or {@code Tuesday 14:00}
     */
    public static String describe(SeasonalPeriod period, int bucket) {
        return switch (period) {
            case HOURLY -> String.format("hour %02d:00", bucket);
            case DAILY -> dayName(bucket);
            case WEEKLY -> String.format("%s %02d:00", dayName(bucket / 24), bucket % 24);
            case NONE -> "overall";
        };
    }

    private static String dayName(int day) {
        String name = DayOfWeek.of(day + 1).name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
