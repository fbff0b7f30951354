package edu.yu.idxcheck.harness;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class StartBarrierTest {

    private static final Logger logger = LogManager.getLogger(StartBarrierTest.class);

    @Test
    @DisplayName("runAll() runs every worker exactly once")
    public void everyWorkerRunsOnce() {
        StartBarrier barrier = new StartBarrier(8, 10);
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        barrier.runAll(wId -> {
            barrier.awaitRelease();
            assertTrue(seen.add(wId));
        });
        assertEquals(Set.of(0, 1, 2, 3, 4, 5, 6, 7), seen);
    }

    @Test
    @DisplayName("No worker passes awaitRelease() before all are spawned")
    public void nobodyPassesBeforeAllSpawned() {
        int workers = 8;
        StartBarrier barrier = new StartBarrier(workers, 20);
        AtomicInteger arrived = new AtomicInteger();
        AtomicInteger earlyStarts = new AtomicInteger();

        barrier.runAll(wId -> {
            arrived.incrementAndGet();
            barrier.awaitRelease();
            if (arrived.get() != workers) {
                earlyStarts.incrementAndGet();
            }
        });
        assertEquals(0, earlyStarts.get());
    }

    @Test
    @DisplayName("Release waits out the settle interval")
    public void settleIntervalElapsesBeforeRelease() {
        StartBarrier barrier = new StartBarrier(4, 50);
        AtomicLong earliest = new AtomicLong(Long.MAX_VALUE);
        long start = System.nanoTime();
        barrier.runAll(wId -> {
            barrier.awaitRelease();
            earliest.accumulateAndGet(System.nanoTime(), Math::min);
        });
        assertTrue(earliest.get() - start >= 50_000_000L, "Released before the settle interval");
    }

    @Test
    @DisplayName("runOneVsRest() gives the last worker id to the solo task")
    public void oneVsRestUsesLastWorkerForSolo() {
        StartBarrier barrier = new StartBarrier(6, 0);
        Set<Integer> soloIds = ConcurrentHashMap.newKeySet();
        Set<Integer> restIds = ConcurrentHashMap.newKeySet();
        barrier.runOneVsRest(soloIds::add, restIds::add);
        assertEquals(Set.of(5), soloIds);
        assertEquals(Set.of(0, 1, 2, 3, 4), restIds);
    }

    @Test
    @DisplayName("Worker failures are collected after every worker joins")
    public void failuresCollectedAfterJoin() {
        StartBarrier barrier = new StartBarrier(4, 0);
        AtomicInteger finished = new AtomicInteger();

        WorkerFailureException e = assertThrows(WorkerFailureException.class, () -> barrier.runAll(wId -> {
            barrier.awaitRelease();
            if (wId % 2 == 1) {
                throw new IllegalStateException("worker " + wId);
            }
            finished.incrementAndGet();
        }));

        assertEquals(2, e.failures().size());
        assertEquals(2, finished.get());
        assertNotNull(e.getCause());
        assertEquals(1, e.getSuppressed().length);
        logger.info("Collected: {}", e.getMessage());
    }

    @Test
    @DisplayName("Barrier runs a new round after a failed one")
    public void barrierReusableAfterFailure() {
        StartBarrier barrier = new StartBarrier(2, 0);
        assertThrows(WorkerFailureException.class, () -> barrier.runAll(wId -> {
            throw new IllegalArgumentException("boom");
        }));

        AtomicInteger ran = new AtomicInteger();
        barrier.runAll(wId -> {
            barrier.awaitRelease();
            ran.incrementAndGet();
        });
        assertEquals(2, ran.get());
    }

    @Test
    @DisplayName("awaitRelease() outside a round is rejected")
    public void awaitOutsideRoundRejected() {
        StartBarrier barrier = new StartBarrier(2, 0);
        assertThrows(IllegalStateException.class, barrier::awaitRelease);
        assertThrows(IllegalArgumentException.class, () -> new StartBarrier(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new StartBarrier(1, -1));
        assertThrows(IllegalArgumentException.class, () -> barrier.runAll(null));
    }
}
