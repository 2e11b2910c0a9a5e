package dev.jobharvest.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedWorkerPoolTest {

    private BoundedWorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new BoundedWorkerPool();
    }

    @Test
    @DisplayName("Should return results in submission order regardless of completion order")
    void shouldPreserveOrder() {
        List<Integer> items = List.of(5, 1, 4, 2, 3);

        List<Optional<String>> results = pool.mapOrdered(items, 3, item -> {
            sleep(item * 10L);
            return Optional.of("item-" + item);
        }, (item, error) -> { });

        assertThat(results).containsExactly(
                Optional.of("item-5"), Optional.of("item-1"), Optional.of("item-4"),
                Optional.of("item-2"), Optional.of("item-3"));
    }

    @Test
    @DisplayName("Should never run more tasks at once than the concurrency limit")
    void shouldBoundInFlightTasks() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> items = IntStream.range(0, 12).boxed().toList();

        pool.mapOrdered(items, 3, item -> {
            int current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            sleep(20);
            inFlight.decrementAndGet();
            return Optional.of(item);
        }, (item, error) -> { });

        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    @DisplayName("Should isolate a failing task and report it")
    void shouldIsolateFailures() {
        Map<Integer, Throwable> failures = new ConcurrentHashMap<>();

        List<Optional<Integer>> results = pool.mapOrdered(List.of(1, 2, 3), 2, item -> {
            if (item == 2) {
                throw new IllegalStateException("boom");
            }
            return Optional.of(item * 10);
        }, failures::put);

        assertThat(results).containsExactly(Optional.of(10), Optional.empty(), Optional.of(30));
        assertThat(failures).containsOnlyKeys(2);
        assertThat(failures.get(2)).hasMessage("boom");
    }

    @Test
    void shouldHandleEmptyInputAndNullResults() {
        assertThat(pool.mapOrdered(List.<Integer>of(), 4, Optional::of, (item, error) -> { })).isEmpty();
        assertThat(pool.mapOrdered(List.of(1), 4, item -> null, (item, error) -> { }))
                .containsExactly(Optional.empty());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
