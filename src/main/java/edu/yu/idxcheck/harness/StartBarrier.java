package edu.yu.idxcheck.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Two-phase start for a round of worker threads.
 * <p>
 * The coordinator spawns one thread per worker, waits until all of them are
 * running, sleeps for the settle interval, then opens the release latch and
 * joins every worker. Workers call {@link #awaitRelease()} once their local
 * setup is done and must not touch the index before it returns.
 * <p>
 * There is no join timeout: a worker stuck inside the index hangs the round.
 */
public class StartBarrier {

    private static final Logger logger = LogManager.getLogger(StartBarrier.class);

    private final int workerCount;
    private final long settleMillis;
    private final AtomicInteger roundCounter;
    private volatile CountDownLatch release;

    public StartBarrier(int workerCount, long settleMillis) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive");
        }
        if (settleMillis < 0) {
            throw new IllegalArgumentException("Settle interval must be >= 0");
        }

        this.workerCount = workerCount;
        this.settleMillis = settleMillis;
        this.roundCounter = new AtomicInteger();
    }

    /**
     * Run {@code worker} on every worker id and wait for all of them.
     *
     * @param worker
     * @throws WorkerFailureException if any worker threw
     */
    public void runAll(IntConsumer worker) {
        if (worker == null) {
            throw new IllegalArgumentException("Worker can't be null");
        }

        runRound(wId -> worker);
    }

    /**
     * Run {@code solo} on the last worker id and {@code rest} on all others.
     *
     * @param solo
     * @param rest
     * @throws WorkerFailureException if any worker threw
     */
    public void runOneVsRest(IntConsumer solo, IntConsumer rest) {
        if (solo == null || rest == null) {
            throw new IllegalArgumentException("Workers can't be null");
        }

        runRound(wId -> wId == this.workerCount - 1 ? solo : rest);
    }

    /**
     * Block the calling worker until the coordinator opens the current round.
     */
    public void awaitRelease() {
        CountDownLatch latch = this.release;
        if (latch == null) {
            throw new IllegalStateException("No barrier round in progress");
        }

        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Thread interrupted while waiting for the start signal", e);
        }
    }

    private void runRound(IntFunction<IntConsumer> roleOf) {
        int round = this.roundCounter.incrementAndGet();
        CountDownLatch spawned = new CountDownLatch(this.workerCount);
        CountDownLatch go = new CountDownLatch(1);
        this.release = go;

        ExecutorService pool = Executors.newFixedThreadPool(this.workerCount, new WorkerThreadFactory(round));
        try {
            List<Future<?>> workers = new ArrayList<>(this.workerCount);
            for (int i = 0; i < this.workerCount; i++) {
                final int wId = i;
                final IntConsumer role = roleOf.apply(wId);
                workers.add(pool.submit(() -> {
                    spawned.countDown();
                    role.accept(wId);
                }));
            }

            spawned.await();
            Thread.sleep(this.settleMillis);

            go.countDown();
            logger.debug("Round {} released {} workers", round, this.workerCount);

            join(round, workers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Coordinator interrupted during round " + round, e);
        } finally {
            // never leave a worker parked on the latch
            go.countDown();
            pool.shutdown();
            this.release = null;
        }
    }

    private void join(int round, List<Future<?>> workers) throws InterruptedException {
        List<Throwable> failures = new ArrayList<>();
        for (int wId = 0; wId < workers.size(); wId++) {
            try {
                workers.get(wId).get();
            } catch (ExecutionException e) {
                logger.error("Worker {} failed in round {}", wId, round, e.getCause());
                failures.add(e.getCause());
            }
        }

        if (!failures.isEmpty()) {
            throw new WorkerFailureException(
                    failures.size() + " of " + workers.size() + " workers failed in round " + round, failures);
        }
    }

    /**
     * Names threads after the round and worker so thread dumps of a hung round
     * are readable.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final int round;
        private final AtomicInteger nextId = new AtomicInteger();

        WorkerThreadFactory(int round) {
            this.round = round;
        }

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "idxcheck-r" + this.round + "-w" + this.nextId.getAndIncrement());
        }
    }
}
