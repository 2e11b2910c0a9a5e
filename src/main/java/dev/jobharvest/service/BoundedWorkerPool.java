package dev.jobharvest.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Runs blocking per-item tasks on a fixed number of worker threads.
 * At most {@code concurrency} tasks are in flight; results come back in submission order.
 */
@Slf4j
@Component
public class BoundedWorkerPool {

    private static final String THREAD_PREFIX = "harvest-worker";

    /**
     * @param items       work items, in submission order
     * @param concurrency maximum number of tasks in flight
     * @param task        per-item work; may block
     * @param onFailure   invoked with the item and the exception of a failed task
     * @return one entry per item; empty for items whose task produced nothing or failed
     */
    public <T, R> List<Optional<R>> mapOrdered(
            List<T> items,
            int concurrency,
            Function<T, Optional<R>> task,
            BiConsumer<T, Throwable> onFailure) {
        if (items.isEmpty()) {
            return List.of();
        }
        int size = Math.max(1, Math.min(concurrency, items.size()));
        Scheduler scheduler = Schedulers.newBoundedElastic(size, items.size(), THREAD_PREFIX);
        log.debug("Dispatching {} tasks on {} workers", items.size(), size);
        try {
            List<Optional<R>> results = Flux.fromIterable(items)
                    .flatMapSequential(item -> Mono.fromCallable(() -> runIsolated(item, task, onFailure))
                            .subscribeOn(scheduler), size)
                    .collectList()
                    .block();
            return results == null ? List.of() : results;
        } finally {
            scheduler.dispose();
        }
    }

    private static <T, R> Optional<R> runIsolated(T item, Function<T, Optional<R>> task,
                                                  BiConsumer<T, Throwable> onFailure) {
        try {
            Optional<R> result = task.apply(item);
            return result == null ? Optional.empty() : result;
        } catch (RuntimeException e) {
            onFailure.accept(item, e);
            return Optional.empty();
        }
    }
}
