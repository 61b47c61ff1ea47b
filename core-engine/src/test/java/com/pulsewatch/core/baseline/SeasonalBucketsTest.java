package com.pulsewatch.core.baseline;

import com.pulsewatch.core.model.SeasonalPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeasonalBuckets}.
 */
class SeasonalBucketsTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    @DisplayName("Should index buckets from Monday 00:00")
    void shouldIndexFromMonday() {
        Instant tuesday1430 = Instant.parse("2026-01-06T14:30:00Z");

        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.HOURLY, tuesday1430, UTC)).isEqualTo(14);
        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.DAILY, tuesday1430, UTC)).isEqualTo(1);
        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.WEEKLY, tuesday1430, UTC)).isEqualTo(24 + 14);
        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.WEEKLY, Instant.parse("2026-01-11T23:59:00Z"), UTC))
                .isEqualTo(167);
    }

    @Test
    @DisplayName("Should bucket in the configured zone")
    void shouldUseZone() {
        Instant utcLateSunday = Instant.parse("2026-01-11T23:30:00Z");

        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.HOURLY, utcLateSunday, ZoneId.of("Europe/Berlin")))
                .isEqualTo(0);
        assertThat(SeasonalBuckets.bucket(SeasonalPeriod.DAILY, utcLateSunday, ZoneId.of("Europe/Berlin")))
                .isEqualTo(0);
    }

    @Test
    @DisplayName("Should describe buckets for humans")
    void shouldDescribe() {
        assertThat(SeasonalBuckets.describe(SeasonalPeriod.HOURLY, 14)).isEqualTo("hour 14:00");
        assertThat(SeasonalBuckets.describe(SeasonalPeriod.DAILY, 1)).isEqualTo("Tuesday");
        assertThat(SeasonalBuckets.describe(SeasonalPeriod.WEEKLY, 24 + 14)).isEqualTo("Tuesday 14:00");
    }
}
