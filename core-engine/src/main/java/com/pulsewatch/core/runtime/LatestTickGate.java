package com.pulsewatch.core.runtime;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latest-tick-wins bookkeeping per key.
 *
 * <p>
 * A tick takes a ticket when it starts. When it finishes it may publish only
 * if no newer tick for the same key has started in the meantime; an
 * overtaken tick runs to completion but its result is discarded.
 * </p>
 *
 * @since 1.0.0
 */
public final class LatestTickGate {

    private final ConcurrentMap<String, AtomicLong> latest = new ConcurrentHashMap<>();
    private final AtomicLong discarded = new AtomicLong();

    /**
     * Start a tick for a key.
     *
     * @return the tick's ticket
     */
    public long begin(String key) {
        return latest.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    public boolean isLatest(String key, long ticket) {
        AtomicLong current = latest.get(key);
        return current != null && current.get() == ticket;
    }

    /**
     * Check a finished tick and count it as discarded if it was overtaken.
     *
     * @return {@code true} if the result may be published
     */
    public boolean tryPublish(String key, long ticket) {
        if (isLatest(key, ticket)) {
            return true;
        }
        discarded.incrementAndGet();
        return false;
    }

    public long discardedTicks() {
        return discarded.get();
    }
}
