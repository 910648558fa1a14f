package com.fightstats.application.harvest;

import com.fightstats.domain.exception.FetchException;
import com.fightstats.domain.exception.HarvestAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs independent harvest tasks on a fixed number of threads and gathers their
 * records in completion order.
 * <p>
 * A task that fails is logged with its candidate and contributes nothing; it never
 * stops the other tasks. Only interruption of the calling thread aborts a run.
 */
public class BoundedTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(BoundedTaskRunner.class);
    private static final int PROGRESS_EVERY = 25;

    private final int parallelism;

    public BoundedTaskRunner(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Runs {@code task} once per candidate.
     *
     * @param phase      label for progress and failure logs
     * @param candidates work items; each is submitted exactly once
     * @param describe   identifies a candidate in failure logs
     * @param task       fetch-and-parse work for one candidate
     * @return records from every successful task, in completion order
     */
    public <T, R> List<R> runAll(String phase,
                                 Collection<T> candidates,
                                 Function<T, String> describe,
                                 HarvestTask<T, R> task) {
        if (candidates.isEmpty()) {
            logger.info("{}: nothing to do", phase);
            return List.of();
        }

        int total = candidates.size();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, total), workerThreads(phase));
        ExecutorCompletionService<List<R>> completion = new ExecutorCompletionService<>(executor);
        logger.info("{}: {} tasks on {} workers", phase, total, Math.min(parallelism, total));

        try {
            for (T candidate : candidates) {
                completion.submit(() -> runOne(phase, candidate, describe, task));
            }

            List<R> results = new ArrayList<>();
            for (int done = 1; done <= total; done++) {
                Future<List<R>> future = completion.take();
                results.addAll(resultOf(phase, future));
                if (done % PROGRESS_EVERY == 0 || done == total) {
                    logger.info("{}: {}/{} done", phase, done, total);
                }
            }
            return results;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new HarvestAbortedException(phase + " interrupted", e);
        } finally {
            shutdown(executor);
        }
    }

    private static <T, R> List<R> runOne(String phase, T candidate, Function<T, String> describe, HarvestTask<T, R> task) {
        try {
            List<R> records = task.run(candidate);
            return records == null ? List.of() : records;
        } catch (FetchException e) {
            logger.warn("{}: failed on {}: {}", phase, describe.apply(candidate), e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("{}: unexpected error on {}", phase, describe.apply(candidate), e);
        }
        return List.of();
    }

    private static <R> List<R> resultOf(String phase, Future<List<R>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // runOne catches everything but Errors
            logger.error("{}: task crashed", phase, e.getCause());
            return List.of();
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads(String phase) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = phase.replaceAll("[^A-Za-z0-9]+", "-").toLowerCase();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
