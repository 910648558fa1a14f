package com.fightstats.application.harvest;

import com.fightstats.domain.exception.FetchException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BoundedTaskRunner.
 */
class BoundedTaskRunnerTest {

    @Test
    void testCollectsResultsFromEveryTask() {
        BoundedTaskRunner runner = new BoundedTaskRunner(4);
        List<Integer> candidates = IntStream.rangeClosed(1, 50).boxed().toList();

        List<Integer> results = runner.runAll("Squares", candidates, Object::toString,
            n -> List.of(n * n));

        assertEquals(50, results.size());
        assertEquals(
            candidates.stream().map(n -> n * n).collect(Collectors.toSet()),
            Set.copyOf(results));
    }

    @Test
    void testFailingTasksAreIsolated() {
        BoundedTaskRunner runner = new BoundedTaskRunner(3);
        List<String> candidates = List.of("a", "fetch-fails", "b", "crashes", "c");

        List<String> results = runner.runAll("Pages", candidates, c -> c, candidate -> {
            if (candidate.equals("fetch-fails")) {
                throw new FetchException("http://example/" + candidate, "HTTP request failed with status 404");
            }
            if (candidate.equals("crashes")) {
                throw new IllegalStateException("parser blew up");
            }
            return List.of(candidate.toUpperCase());
        });

        assertEquals(Set.of("A", "B", "C"), Set.copyOf(results));
        assertEquals(3, results.size());
    }

    @Test
    void testConcurrencyNeverExceedsBound() {
        int bound = 3;
        BoundedTaskRunner runner = new BoundedTaskRunner(bound);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Set<String> threads = ConcurrentHashMap.newKeySet();

        List<Integer> candidates = IntStream.range(0, 20).boxed().toList();
        List<Integer> results = runner.runAll("Bounded", candidates, Object::toString, n -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            threads.add(Thread.currentThread().getName());
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return List.of(n);
        });

        assertEquals(20, results.size());
        assertTrue(peak.get() <= bound, "peak concurrency was " + peak.get());
        assertTrue(threads.size() <= bound);
        assertTrue(threads.stream().allMatch(name -> name.startsWith("bounded-")));
    }

    @Test
    void testEachCandidateRunsExactlyOnce() {
        BoundedTaskRunner runner = new BoundedTaskRunner(8);
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        List<String> candidates = List.of("x", "y", "z");

        runner.runAll("Once", candidates, c -> c, c -> {
            seen.add(c);
            return List.of();
        });

        assertEquals(3, seen.size());
        assertEquals(Set.copyOf(candidates), Set.copyOf(seen));
    }

    @Test
    void testEmptyInputRunsNothing() {
        BoundedTaskRunner runner = new BoundedTaskRunner(2);

        List<String> results = runner.runAll("Nothing", List.<String>of(), c -> c, c -> List.of(c));

        assertTrue(results.isEmpty());
    }

    @Test
    void testNullResultCountsAsEmpty() {
        BoundedTaskRunner runner = new BoundedTaskRunner(1);

        List<String> results = runner.runAll("Nulls", List.of("a"), c -> c, c -> null);

        assertTrue(results.isEmpty());
    }

    @Test
    void testRejectsNonPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedTaskRunner(0));
        assertThrows(IllegalArgumentException.class, () -> new BoundedTaskRunner(-3));
    }
}
