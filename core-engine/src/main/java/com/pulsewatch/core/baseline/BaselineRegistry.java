package com.pulsewatch.core.baseline;

import com.pulsewatch.core.model.SeasonalBaseline;
import com.pulsewatch.core.model.SeriesKey;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Current baseline snapshot per series.
 *
 * <p>
 * Each entry is an immutable {@link Snapshot}; publishing replaces the
 * reference atomically, so a reader sees either the previous or the new
 * baseline and never a mix of both.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineRegistry {

    /**
     * One published version of a series baseline.
     *
     * @param stale {@code true} when the last recompute failed and this
     *              baseline was kept
     */
    public record Snapshot(SeasonalBaseline baseline, long version, boolean stale) {
    }

    private final ConcurrentMap<SeriesKey, Snapshot> current = new ConcurrentHashMap<>();

    /**
     * Publish a new baseline for its series.
     *
     * @return the version assigned to it
     */
    public long publish(SeasonalBaseline baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        SeriesKey key = new SeriesKey(baseline.getService(), baseline.getMetricName());
        return current.merge(key, new Snapshot(baseline, 1, false),
                (old, fresh) -> new Snapshot(baseline, old.version() + 1, false)).version();
    }

    /**
     * Keep the current baseline but flag it as stale.
     */
    public void markStale(SeriesKey key) {
        current.computeIfPresent(key, (k, s) -> new Snapshot(s.baseline(), s.version(), true));
    }

    public Optional<Snapshot> snapshot(SeriesKey key) {
        return Optional.ofNullable(current.get(key));
    }

    public Optional<SeasonalBaseline> current(SeriesKey key) {
        return snapshot(key).map(Snapshot::baseline);
    }

    public boolean isStale(SeriesKey key) {
        Snapshot s = current.get(key);
        return s != null && s.stale();
    }

    public long staleCount() {
        return current.values().stream().filter(Snapshot::stale).count();
    }

    public int size() {
        return current.size();
    }
}
