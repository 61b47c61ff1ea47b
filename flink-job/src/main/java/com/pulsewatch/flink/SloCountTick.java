package com.pulsewatch.flink;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Good and bad event counts of one SLO observed at an instant. Produced by
 * classifying metric samples, or read pre-aggregated from Kafka.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SloCountTick implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sloId;
    private final Instant timestamp;
    private final long goodCount;
    private final long badCount;

    @JsonCreator
    public SloCountTick(@JsonProperty("sloId") String sloId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("goodCount") long goodCount,
            @JsonProperty("badCount") long badCount) {
        this.sloId = Objects.requireNonNull(sloId, "sloId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (goodCount < 0 || badCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        this.goodCount = goodCount;
        this.badCount = badCount;
    }

    public String getSloId() {
        return sloId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getGoodCount() {
        return goodCount;
    }

    public long getBadCount() {
        return badCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloCountTick that))
            return false;
        return goodCount == that.goodCount && badCount == that.badCount
                && sloId.equals(that.sloId) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sloId, timestamp, goodCount, badCount);
    }

    @Override
    public String toString() {
        return "SloCountTick{" + sloId + " @" + timestamp + " good=" + goodCount + " bad=" + badCount + '}';
    }
}
