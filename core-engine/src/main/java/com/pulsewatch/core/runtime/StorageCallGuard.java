package com.pulsewatch.core.runtime;

import com.pulsewatch.core.config.RuntimeSettings;
import com.pulsewatch.core.error.StorageUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs storage reads under a Resilience4j {@link TimeLimiter} per attempt and
 * a {@link Retry} with capped exponential backoff.
 *
 * <p>
 * A call never blocks longer than
 * {@code attempts * timeout + sum(backoff)}. When every attempt fails the
 * call ends with a {@link StorageUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class StorageCallGuard implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StorageCallGuard.class);

    private final IntervalFunction backoff;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public StorageCallGuard(RuntimeSettings settings) {
        this(settings.storageTimeout(), settings.getRetryAttempts(), settings.getRetryBackoffMillis(),
                settings.getRetryBackoffCapMillis());
    }

    public StorageCallGuard(Duration timeout, int attempts, long backoffMillis, long backoffCapMillis) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
        }
        if (backoffMillis < 1 || backoffCapMillis < backoffMillis) {
            throw new IllegalArgumentException("backoff must be >= 1 ms and <= cap");
        }
        this.backoff = IntervalFunction.ofExponentialBackoff(backoffMillis, 2.0, backoffCapMillis);
        this.retry = Retry.of("storage", RetryConfig.custom()
                .maxAttempts(attempts)
                .intervalFunction(backoff)
                .ignoreExceptions(InterruptedException.class)
                .build());
        this.timeLimiter = TimeLimiter.of("storage", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        this.retry.getEventPublisher().onRetry(event -> LOG.debug(
                "Storage call failed (attempt {}/{}), retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), attempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pulsewatch-storage-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param operation short description used in logs and errors
     * @param call      the storage call
     * @return the call's result
     * @throws StorageUnavailableException when all attempts fail or time out
     */
    public <T> T call(String operation, Callable<T> call) {
        AtomicInteger made = new AtomicInteger();
        Callable<T> limited = () -> {
            made.incrementAndGet();
            return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
        };
        try {
            return retry.executeCallable(limited);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException(operation + " interrupted", made.get(), e);
        } catch (Exception e) {
            LOG.debug("{} gave up after {} attempt(s): {}", operation, made.get(), e.getMessage());
            throw new StorageUnavailableException(operation + " failed after " + made.get() + " attempt(s)",
                    made.get(), e);
        }
    }

    /**
     * Backoff before retry number {@code attempt + 1}.
     */
    long backoff(int attempt) {
        return backoff.apply(attempt);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
