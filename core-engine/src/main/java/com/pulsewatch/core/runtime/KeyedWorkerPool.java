package com.pulsewatch.core.runtime;

import com.pulsewatch.core.error.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fixed set of single-threaded workers, each draining its own bounded queue.
 *
 * <h3>Ownership</h3>
 * <p>
 * A key is always routed to the same worker, so every task for one key runs
 * sequentially on one thread and never concurrently with another task for
 * the same key. Different keys run in parallel.
 * </p>
 *
 * <h3>Backpressure</h3>
 * <p>
 * {@link #submit} never blocks. When a worker queue is full the oldest
 * queued task is dropped to make room, the drop is counted and reported to
 * the drop handler as a {@link CapacityExceededException}.
 * </p>
 *
 * @since 1.0.0
 */
public class KeyedWorkerPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedWorkerPool.class);

    private final String name;
    private final Worker[] workers;
    private final int queueCapacity;
    private final Consumer<CapacityExceededException> dropHandler;
    private final AtomicLong failedTasks = new AtomicLong();

    public KeyedWorkerPool(int workerCount, int queueCapacity) {
        this("worker", workerCount, queueCapacity);
    }

    public KeyedWorkerPool(String name, int workerCount, int queueCapacity) {
        this(name, workerCount, queueCapacity, e -> LOG.warn(e.getMessage()));
    }

    public KeyedWorkerPool(int workerCount, int queueCapacity, Consumer<CapacityExceededException> dropHandler) {
        this("worker", workerCount, queueCapacity, dropHandler);
    }

    /**
     * @param name          pool name, used in thread names and logs
     * @param workerCount   number of worker threads
     * @param queueCapacity bound of each worker queue
     * @param dropHandler   told about every dropped task
     */
    public KeyedWorkerPool(String name, int workerCount, int queueCapacity,
            Consumer<CapacityExceededException> dropHandler) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.dropHandler = Objects.requireNonNull(dropHandler, "dropHandler must not be null");
        this.workers = new Worker[workerCount];
        for (int i = 0; i < workerCount; i++) {
            workers[i] = new Worker(i, queueCapacity);
            workers[i].thread.start();
        }
        LOG.info("Worker pool '{}' started workers={}, queueCapacity={}", name, workerCount, queueCapacity);
    }

    /**
     * Queue a task for a key.
     *
     * @return {@code false} if the pool is closed and the task was rejected
     */
    public boolean submit(String key, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Worker worker = workerFor(key);
        if (worker.closed) {
            return false;
        }
        Task entry = new Task(key, task);
        while (!worker.queue.offerLast(entry)) {
            Task dropped = worker.queue.pollFirst();
            if (dropped != null) {
                long count = worker.dropped.incrementAndGet();
                dropHandler.accept(new CapacityExceededException(
                        "Worker " + name + "-" + worker.index + " queue full, dropped oldest task for key '" + dropped.key
                                + "' (" + count + " dropped so far)", queueCapacity));
            }
        }
        return true;
    }

    int indexOf(String key) {
        return Math.floorMod(key.hashCode(), workers.length);
    }

    private Worker workerFor(String key) {
        return workers[indexOf(key)];
    }

    // ---------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------

    public long droppedTasks() {
        long total = 0;
        for (Worker w : workers) {
            total += w.dropped.get();
        }
        return total;
    }

    public long droppedTasks(int workerIndex) {
        return workers[workerIndex].dropped.get();
    }

    public long failedTasks() {
        return failedTasks.get();
    }

    public int queueDepth() {
        int depth = 0;
        for (Worker w : workers) {
            depth += w.queue.size();
        }
        return depth;
    }

    public int workerCount() {
        return workers.length;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    /**
     * Wait until every queue is empty and no task is running.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!idle()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private boolean idle() {
        for (Worker w : workers) {
            if (!w.queue.isEmpty() || w.active.get() > 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        for (Worker w : workers) {
            w.closed = true;
            w.thread.interrupt();
        }
        for (Worker w : workers) {
            try {
                w.thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Worker pool '{}' stopped, dropped={}, failed={}", name, droppedTasks(), failedTasks.get());
    }

    // ---------------------------------------------------------------
    // Worker
    // ---------------------------------------------------------------

    private record Task(String key, Runnable body) {
    }

    private final class Worker {

        private final int index;
        private final LinkedBlockingDeque<Task> queue;
        private final AtomicLong dropped = new AtomicLong();
        private final AtomicInteger active = new AtomicInteger();
        private final Thread thread;
        private volatile boolean closed;

        Worker(int index, int capacity) {
            this.index = index;
            this.queue = new LinkedBlockingDeque<>(capacity);
            this.thread = new Thread(this::drainLoop, "pulsewatch-" + name + "-" + index);
            this.thread.setDaemon(true);
        }

        private void drainLoop() {
            try {
                while (!closed) {
                    Task task = queue.take();
                    active.incrementAndGet();
                    try {
                        task.body().run();
                    } catch (RuntimeException ex) {
                        failedTasks.incrementAndGet();
                        LOG.error("Task for key '{}' failed on worker {}-{}", task.key(), name, index, ex);
                    } finally {
                        active.decrementAndGet();
                    }
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
