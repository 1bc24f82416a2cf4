package com.eyelevel.dispatcher.common.concurrent;

import com.eyelevel.dispatcher.exception.TaskGroupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs a batch of independent units on at most {@code workers} threads and waits for all of them.
 * A failing unit never cancels its siblings; failures are collected and reported once everything finished.
 * Closing the group shuts its threads down.
 */
@Slf4j
public class BoundedTaskGroup implements AutoCloseable {

    private final String name;
    private final ThreadPoolTaskExecutor executor;
    private final Map<String, Future<?>> futures = new LinkedHashMap<>();

    public BoundedTaskGroup(final String name, final int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.name = name;
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix(name + "-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
    }

    public void submit(final String itemId, final Callable<?> unit) {
        futures.put(itemId, executor.submit(unit));
    }

    public void submit(final String itemId, final Runnable unit) {
        futures.put(itemId, executor.submit(unit));
    }

    /**
     * Waits for every submitted unit.
     *
     * @return The outcome of the batch, with failures keyed by item id in submission order.
     * @throws TaskGroupException if the waiting thread is interrupted.
     */
    public Outcome awaitAll() {
        final Map<String, Throwable> failures = new LinkedHashMap<>();
        final List<String> succeeded = new ArrayList<>();
        for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
            try {
                entry.getValue().get();
                succeeded.add(entry.getKey());
            } catch (ExecutionException e) {
                failures.put(entry.getKey(), e.getCause() == null ? e : e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.getThreadPoolExecutor().shutdownNow();
                throw new TaskGroupException("Interrupted while waiting for task group '" + name + "'", e);
            }
        }
        futures.clear();
        if (!failures.isEmpty()) {
            log.warn("Task group '{}' finished with {} failed and {} succeeded units.", name, failures.size(),
                     succeeded.size());
        }
        return new Outcome(Collections.unmodifiableList(succeeded), Collections.unmodifiableMap(failures));
    }

    /**
     * Waits for every submitted unit and raises the first failure, in submission order, if any unit failed.
     */
    public Outcome awaitAllOrThrow() {
        final Outcome outcome = awaitAll();
        if (!outcome.failures().isEmpty()) {
            final Map.Entry<String, Throwable> first = outcome.failures().entrySet().iterator().next();
            throw new TaskGroupException(
                    "Task group '%s': %d unit(s) failed, first was '%s'".formatted(name, outcome.failures().size(),
                                                                                 first.getKey()), first.getValue());
        }
        return outcome;
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    /**
     * @param succeeded ids of units that completed normally
     * @param failures  the failure of each unit that threw, keyed by id
     */
    public record Outcome(List<String> succeeded, Map<String, Throwable> failures) {
    }
}
