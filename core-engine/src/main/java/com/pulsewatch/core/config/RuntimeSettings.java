package com.pulsewatch.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker pool and storage access settings ({@code runtime:} section).
 *
 * @since 1.0.0
 */
public class RuntimeSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Worker threads; {@code 0} means one per available processor. */
    private int workers = 0;

    /** Bounded inbound queue per worker; the oldest task is dropped on overflow. */
    private int queueCapacity = 10_000;

    private long storageTimeoutMillis = 5_000;
    private int retryAttempts = 3;
    private long retryBackoffMillis = 200;
    private long retryBackoffCapMillis = 2_000;

    public List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (workers < 0) {
            errors.add("runtime.workers must be >= 0");
        }
        if (queueCapacity < 1) {
            errors.add("runtime.queueCapacity must be >= 1");
        }
        if (storageTimeoutMillis < 1) {
            errors.add("runtime.storageTimeoutMillis must be >= 1");
        }
        if (retryAttempts < 1) {
            errors.add("runtime.retryAttempts must be >= 1");
        }
        if (retryBackoffMillis < 1 || retryBackoffCapMillis < retryBackoffMillis) {
            errors.add("runtime requires 1 <= retryBackoffMillis <= retryBackoffCapMillis");
        }
        return errors;
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public Duration storageTimeout() {
        return Duration.ofMillis(storageTimeoutMillis);
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getStorageTimeoutMillis() {
        return storageTimeoutMillis;
    }

    public void setStorageTimeoutMillis(long storageTimeoutMillis) {
        this.storageTimeoutMillis = storageTimeoutMillis;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public long getRetryBackoffCapMillis() {
        return retryBackoffCapMillis;
    }

    public void setRetryBackoffCapMillis(long retryBackoffCapMillis) {
        this.retryBackoffCapMillis = retryBackoffCapMillis;
    }
}
