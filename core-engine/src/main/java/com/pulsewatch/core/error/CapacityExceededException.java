package com.pulsewatch.core.error;

/**
 * Signals that a bounded structure (template set, inbound queue) is full.
 *
 * <p>
 * Only used to describe the condition to the component applying the
 * eviction or drop policy; it is logged and counted, never propagated.
 * </p>
 *
 * @since 1.0.0
 */
public class CapacityExceededException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final int capacity;

    public CapacityExceededException(String message, int capacity) {
        super(ErrorKind.CAPACITY_EXCEEDED, message);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
