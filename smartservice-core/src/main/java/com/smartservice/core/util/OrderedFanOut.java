package com.smartservice.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Maps independent items over a short-lived worker pool and returns the results in input
 * order.
 *
 * <p>Tasks must not share mutable state; each returns its own result (including its own
 * diagnostics), so merging by input order is deterministic and needs no locking.
 * With a parallelism of 1 the items are processed on the calling thread.
 */
public final class OrderedFanOut {

    private OrderedFanOut() {
        // Utility class
    }

    /**
     * Applies {@code task} to every item.
     *
     * @param items input items
     * @param task task applied to each item
     * @param parallelism maximum worker count
     * @param <T> item type
     * @param <R> result type
     * @return results, one per item, in input order
     */
    public static <T, R> List<R> map(List<T> items, Function<T, R> task, int parallelism) {
        if (parallelism <= 1 || items.size() <= 1) {
            List<R> results = new ArrayList<>(items.size());
            for (T item : items) {
                results.add(task.apply(item));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, items.size()));
        try {
            List<Future<R>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(executor.submit(() -> task.apply(item)));
            }
            List<R> results = new ArrayList<>(items.size());
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Worker failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
