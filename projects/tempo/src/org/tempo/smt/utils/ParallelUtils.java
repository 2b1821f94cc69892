package org.tempo.smt.utils;

import org.tempo.common.TempoException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs independent checks on a fixed thread pool.
 */
public class ParallelUtils {

    private ParallelUtils() {}

    /**
     * Run every task to completion and return their results in task order.
     * The first task to fail aborts the call with its exception.
     */
    public static <T> List<T> invokeAll(List<Callable<T>> tasks, int parallelism) {
        if (tasks.isEmpty()) {
            return new ArrayList<>();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TempoException("Interrupted while waiting for checks", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new TempoException("Check failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Run every task and return the first present result, in task order.
     */
    public static <T> Optional<T> firstPresent(List<Callable<Optional<T>>> tasks, int parallelism) {
        for (Optional<T> result : invokeAll(tasks, parallelism)) {
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
