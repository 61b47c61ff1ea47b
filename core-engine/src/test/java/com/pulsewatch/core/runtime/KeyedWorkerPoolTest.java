package com.pulsewatch.core.runtime;

import com.pulsewatch.core.error.CapacityExceededException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KeyedWorkerPool}.
 */
class KeyedWorkerPoolTest {

    private KeyedWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    @DisplayName("Should run tasks of one key in submission order")
    void shouldPreserveOrderPerKey() {
        pool = new KeyedWorkerPool(4, 1_000);
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 200; i++) {
            int n = i;
            pool.submit("checkout|latency_ms", () -> seen.add(n));
        }

        assertThat(pool.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactlyElementsOf(
                IntStream.range(0, 200).boxed().collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should drop the oldest queued task when a worker queue is full")
    void shouldDropOldestOnOverflow() throws InterruptedException {
        List<CapacityExceededException> drops = new CopyOnWriteArrayList<>();
        pool = new KeyedWorkerPool(1, 2, drops::add);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> ran = new CopyOnWriteArrayList<>();

        pool.submit("k", () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        pool.submit("k", () -> ran.add("first"));
        pool.submit("k", () -> ran.add("second"));
        pool.submit("k", () -> ran.add("third"));
        release.countDown();

        assertThat(pool.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(ran).containsExactly("second", "third");
        assertThat(pool.droppedTasks()).isEqualTo(1);
        assertThat(pool.droppedTasks(0)).isEqualTo(1);
        assertThat(drops).singleElement().satisfies(e -> {
            assertThat(e.getCapacity()).isEqualTo(2);
            assertThat(e.getMessage()).contains("dropped oldest task for key 'k'");
        });
    }

    @Test
    @DisplayName("Should keep the worker alive after a failing task")
    void shouldIsolateFailures() {
        pool = new KeyedWorkerPool(1, 10);
        List<String> ran = new CopyOnWriteArrayList<>();

        pool.submit("k", () -> {
            throw new IllegalStateException("boom");
        });
        pool.submit("k", () -> ran.add("after"));

        assertThat(pool.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(ran).containsExactly("after");
        assertThat(pool.failedTasks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should route a key to the same worker every time")
    void shouldRouteKeysStably() {
        pool = new KeyedWorkerPool(3, 10);

        int index = pool.indexOf("slo|checkout-availability");

        assertThat(index).isBetween(0, 2);
        assertThat(pool.indexOf("slo|checkout-availability")).isEqualTo(index);
        assertThat(pool.workerCount()).isEqualTo(3);
        assertThat(pool.queueCapacity()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject tasks after close")
    void shouldRejectAfterClose() {
        pool = new KeyedWorkerPool(1, 10);
        pool.close();

        assertThat(pool.submit("k", () -> { })).isFalse();
    }
}
