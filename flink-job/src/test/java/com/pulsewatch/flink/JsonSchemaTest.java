package com.pulsewatch.flink;

import com.pulsewatch.core.model.AnomalyEvent;
import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.MetricSample;
import com.pulsewatch.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonDeserializationSchema} and {@link JsonSerializationSchema}.
 */
class JsonSchemaTest {

    @Test
    @DisplayName("Should read a metric sample and ignore unknown fields")
    void shouldReadSample() {
        String json = "{\"service\":\"checkout\",\"metricName\":\"latency_ms\","
                + "\"timestamp\":\"2026-05-04T10:00:00Z\",\"value\":123.5,\"host\":\"web-1\"}";

        MetricSample sample = new JsonDeserializationSchema<>(MetricSample.class)
                .deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(sample).isEqualTo(new MetricSample("checkout", "latency_ms",
                Instant.parse("2026-05-04T10:00:00Z"), 123.5));
    }

    @Test
    @DisplayName("Should drop malformed and empty messages")
    void shouldDropMalformed() {
        JsonDeserializationSchema<MetricSample> schema = new JsonDeserializationSchema<>(MetricSample.class);

        assertThat(schema.deserialize("{not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize("{\"value\":1}".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.isEndOfStream(null)).isFalse();
    }

    @Test
    @DisplayName("Should read an SLO count tick")
    void shouldReadCountTick() {
        String json = "{\"sloId\":\"checkout-availability\",\"timestamp\":\"2026-05-04T10:00:00Z\","
                + "\"goodCount\":990,\"badCount\":10}";

        SloCountTick tick = new JsonDeserializationSchema<>(SloCountTick.class)
                .deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(tick.getSloId()).isEqualTo("checkout-availability");
        assertThat(tick.getGoodCount()).isEqualTo(990);
        assertThat(tick.getBadCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should write anomalies with ISO timestamps and lowercase labels")
    void shouldWriteAnomaly() {
        AnomalyEvent event = AnomalyEvent.builder()
                .service("checkout")
                .metricOrPattern("latency_ms")
                .timestamp(Instant.parse("2026-05-04T10:00:00Z"))
                .observed(175)
                .expected(120)
                .expectedStd(10)
                .deviationSigma(5.5)
                .score(1.0)
                .confidence(0.9)
                .method(DetectionMethod.SEASONAL)
                .severity(Severity.CRITICAL)
                .details("Unusual for hour 14:00 (expected ~120.00)")
                .build();

        String json = new String(new JsonSerializationSchema<AnomalyEvent>().serialize(event), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"timestamp\":\"2026-05-04T10:00:00Z\"")
                .contains("\"method\":\"seasonal\"")
                .contains("\"severity\":\"critical\"")
                .contains("\"service\":\"checkout\"");
    }
}
