package edu.yu.idxcheck.harness;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.idxcheck.epoch.EpochGuard;
import edu.yu.idxcheck.epoch.ProtectedEpochs;
import edu.yu.idxcheck.index.IndexEntry;

/**
 * The verification steps scenarios are composed from. Each step runs one
 * barrier round (or, for bulkload, a single call from the coordinator) and
 * reports mismatches to the oracle's {@link ViolationCollector}.
 * <p>
 * Instances are bound to one prepared index and data set; see
 * {@link ScenarioOrchestrator#run}.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public final class ScenarioPhases<K, V> {

    private static final Logger logger = LogManager.getLogger(ScenarioPhases.class);

    private final HarnessParameters params;
    private final CapabilityGate gate;
    private final StartBarrier barrier;
    private final AccessPatternGenerator generator;
    private final OperationDriver<K, V> driver;
    private final EpochCoordinator epochs;
    private final Oracle<K, V> oracle;

    ScenarioPhases(HarnessParameters params, CapabilityGate gate, StartBarrier barrier,
            AccessPatternGenerator generator, OperationDriver<K, V> driver, EpochCoordinator epochs,
            Oracle<K, V> oracle) {
        this.params = params;
        this.gate = gate;
        this.barrier = barrier;
        this.generator = generator;
        this.driver = driver;
        this.epochs = epochs;
        this.oracle = oracle;
    }

    /*
     * Mutation phases
     */

    public void verifyWrite(boolean isUpdate, AccessPattern pattern) {
        logger.debug("verifyWrite(isUpdate={}, {})", isUpdate, pattern);

        this.barrier.runAll(wId -> {
            for (int id : targetIdsAndWait(wId, pattern)) {
                int rc = this.driver.write(id, this.oracle.payloadIdFor(wId, isUpdate));
                this.oracle.checkResultCode("write", id, rc, true);
            }
        });
    }

    public void verifyInsert(boolean expectSuccess, boolean isUpdate, AccessPattern pattern) {
        logger.debug("verifyInsert(expectSuccess={}, isUpdate={}, {})", expectSuccess, isUpdate, pattern);

        this.barrier.runAll(wId -> {
            for (int id : targetIdsAndWait(wId, pattern)) {
                int rc = this.driver.insert(id, this.oracle.payloadIdFor(wId, isUpdate));
                this.oracle.checkResultCode("insert", id, rc, expectSuccess);
            }
        });
    }

    public void verifyUpdate(boolean expectSuccess, AccessPattern pattern) {
        logger.debug("verifyUpdate(expectSuccess={}, {})", expectSuccess, pattern);

        this.barrier.runAll(wId -> {
            for (int id : targetIdsAndWait(wId, pattern)) {
                int rc = this.driver.update(id, this.oracle.payloadIdFor(wId, true));
                this.oracle.checkResultCode("update", id, rc, expectSuccess);
            }
        });
    }

    public void verifyDelete(boolean expectSuccess, AccessPattern pattern) {
        logger.debug("verifyDelete(expectSuccess={}, {})", expectSuccess, pattern);

        this.barrier.runAll(wId -> {
            for (int id : targetIdsAndWait(wId, pattern)) {
                int rc = this.driver.delete(id);
                this.oracle.checkResultCode("delete", id, rc, expectSuccess);
            }
        });
    }

    /**
     * Load key ids {@code [threadNum, (execNum + 1) * threadNum)} with payload
     * {@code id % threadNum}, i.e. the state a first sequential write leaves.
     */
    public void verifyBulkload() {
        if (!this.gate.hasBulkload()) {
            return;
        }
        logger.debug("verifyBulkload()");

        int threadNum = this.params.threadNum();
        int endId = (this.params.execNum() + 1) * threadNum;
        List<IndexEntry<K, V>> entries = this.driver.entries(threadNum, endId, id -> id % threadNum);

        int rc = this.driver.bulkload(entries, threadNum);
        this.oracle.checkResultCode("bulkload", threadNum, rc, true);
    }

    /*
     * Read phases
     */

    public void verifyRead(boolean expectSuccess, boolean isUpdate, AccessPattern pattern) {
        logger.debug("verifyRead(expectSuccess={}, isUpdate={}, {})", expectSuccess, isUpdate, pattern);

        this.barrier.runAll(wId -> {
            int expectedPayId = this.oracle.payloadIdFor(wId, isUpdate);
            for (int id : targetIdsAndWait(wId, pattern)) {
                this.oracle.checkRead(id, this.driver.read(id), expectSuccess, expectedPayId);
            }
        });
    }

    /**
     * Each worker scans {@code [threadNum + execNum * w, execNum * (w + 1))}
     * under one shared snapshot taken after forwarding the epoch.
     */
    public void verifyScan(boolean expectSuccess, boolean isUpdate) {
        if (!this.gate.hasScan()) {
            return;
        }
        logger.debug("verifyScan(expectSuccess={}, isUpdate={})", expectSuccess, isUpdate);

        int threadNum = this.params.threadNum();
        int execNum = this.params.execNum();

        this.epochs.forwardGlobalEpoch();
        try (ProtectedEpochs protectedEpochs = this.epochs.getProtectedEpochs()) {
            this.barrier.runAll(wId -> {
                int beginId = threadNum + execNum * wId;
                int endId = execNum * (wId + 1);
                this.barrier.awaitRelease();

                Iterator<IndexEntry<K, V>> iter = this.driver.scan(protectedEpochs, beginId, endId);
                this.oracle.checkRangeScan(iter, beginId, endId, expectSuccess, isUpdate);
            });
        }
    }

    /*
     * Snapshot phases
     */

    /**
     * Write everything, take a snapshot, then let one worker snapshot-read every
     * written key while the others overwrite the same keys. The reader must only
     * ever see the first write.
     */
    public void verifySnapshotRead() {
        logger.debug("verifySnapshotRead()");

        verifyWrite(false, AccessPattern.SEQUENTIAL);
        this.epochs.forwardGlobalEpoch();

        int threadNum = this.params.threadNum();
        int endId = (this.params.execNum() + 1) * threadNum;

        try (ProtectedEpochs protectedEpochs = this.epochs.getProtectedEpochs()) {
            IntConsumer snapshotReader = wId -> {
                List<Integer> ids = this.generator.sequentialIds(endId);
                this.barrier.awaitRelease();

                for (int id : ids.subList(threadNum, endId)) {
                    Optional<V> actual = this.driver.snapshotRead(id, protectedEpochs);
                    this.oracle.checkSnapshotRead(id, actual, this.oracle.payloadIdForKey(id, false));
                }
            };
            IntConsumer writer = wId -> {
                for (int id : targetIdsAndWait(wId, AccessPattern.SEQUENTIAL)) {
                    int rc = this.driver.write(id, this.oracle.payloadIdFor(wId, true));
                    this.oracle.checkResultCode("write", id, rc, true);
                }
            };

            this.barrier.runOneVsRest(snapshotReader, writer);
        }
    }

    /**
     * Write everything, take a snapshot and forward the epoch twice more, then
     * let one worker scan the snapshot while the others apply {@code writeOps}
     * to the scanned keys. The scan must match the pre-snapshot state exactly.
     *
     * @param writeOps the concurrent mutation; {@link WriteOperation#INSERT} is
     *                 rejected because every key already exists
     * @param pattern
     */
    public void verifySnapshotScanWith(WriteOperation writeOps, AccessPattern pattern) {
        if (writeOps == WriteOperation.INSERT) {
            throw new IllegalArgumentException("Insert can't run against a fully written key range");
        }
        logger.debug("verifySnapshotScanWith({}, {})", writeOps, pattern);

        verifyWrite(false, AccessPattern.SEQUENTIAL);
        this.epochs.forwardGlobalEpoch();

        int threadNum = this.params.threadNum();
        int beginId = threadNum;
        int endId = this.params.execNum() * threadNum;

        try (ProtectedEpochs protectedEpochs = this.epochs.getProtectedEpochs()) {
            // the protected list now ends with the snapshot's oldest epoch
            this.epochs.forwardGlobalEpoch();
            this.epochs.forwardGlobalEpoch();

            IntConsumer scanner = wId -> {
                this.barrier.awaitRelease();
                Iterator<IndexEntry<K, V>> iter = this.driver.scan(protectedEpochs, beginId, endId);
                this.oracle.checkRangeScan(iter, beginId, endId, true, false);
            };

            this.barrier.runOneVsRest(scanner, concurrentMutator(writeOps, pattern));
        }
    }

    private IntConsumer concurrentMutator(WriteOperation writeOps, AccessPattern pattern) {
        switch (writeOps) {
            case WRITE -> {
                return wId -> {
                    for (int id : targetIdsAndWait(wId, pattern)) {
                        int rc = this.driver.write(id, this.oracle.payloadIdFor(wId, true));
                        this.oracle.checkResultCode("write", id, rc, true);
                    }
                };
            }
            case UPDATE -> {
                return wId -> {
                    for (int id : targetIdsAndWait(wId, pattern)) {
                        int rc = this.driver.update(id, this.oracle.payloadIdFor(wId, true));
                        this.oracle.checkResultCode("update", id, rc, true);
                    }
                };
            }
            case DELETE -> {
                return wId -> {
                    for (int id : targetIdsAndWait(wId, pattern)) {
                        int rc = this.driver.delete(id);
                        this.oracle.checkResultCode("delete", id, rc, true);
                    }
                };
            }
            case NONE -> {
                return wId -> this.barrier.awaitRelease();
            }
            default -> {
                throw new IllegalArgumentException("Unsupported concurrent mutation: " + writeOps);
            }
        }
    }

    /*
     * Concurrent structural modifications
     */

    /**
     * Workers are split by id into four roles: the lower half alternately write
     * and delete their own keys, the third quarter reads sampled keys and the
     * last quarter scans continuously until every writer/deleter has finished.
     * Roles of even and odd writer ids swap between the two halves of each
     * repetition so every key is inserted and deleted many times.
     * <p>
     * The scan loop has no timeout: a stalled writer hangs the scenario.
     */
    public void verifyConcurrentSmos() {
        int threadNum = this.params.threadNum();
        if (threadNum % 4 != 0) {
            throw new IllegalStateException("Concurrent SMOs need a thread count divisible by 4");
        }
        logger.debug("verifyConcurrentSmos()");

        int readThread = threadNum / 2;
        int scanThread = threadNum * 3 / 4;
        AtomicInteger finishedMutators = new AtomicInteger();

        IntConsumer readProc = wId -> {
            for (int id : smoTargetIdsAndWait()) {
                if (this.oracle.checkInKeyUniverse(id)) {
                    this.oracle.checkConcurrentRead(id, this.driver.read(id));
                }
            }
        };

        IntConsumer scanProc = wId -> {
            this.barrier.awaitRelease();
            this.epochs.forwardGlobalEpoch();
            try (EpochGuard guard = this.epochs.createEpochGuard()) {
                while (finishedMutators.get() < readThread) {
                    K previous = this.driver.key(0);
                    for (Iterator<IndexEntry<K, V>> iter = this.driver.scan(guard); iter.hasNext();) {
                        previous = this.oracle.checkAscending(previous, iter.next().key());
                    }
                }
            }
        };

        IntConsumer writeProc = wId -> {
            try {
                for (int id : targetIdsAndWait(wId, AccessPattern.RANDOM)) {
                    this.oracle.checkResultCode("write", id, this.driver.write(id, wId), true);
                }
            } finally {
                finishedMutators.incrementAndGet();
            }
        };

        IntConsumer deleteProc = wId -> {
            try {
                for (int id : targetIdsAndWait(wId, AccessPattern.RANDOM)) {
                    this.oracle.checkResultCode("delete", id, this.driver.delete(id), true);
                }
            } finally {
                finishedMutators.incrementAndGet();
            }
        };

        IntConsumer initWorker = wId -> {
            if (wId < readThread && wId % 2 == 0) {
                writeProc.accept(wId);
            }
        };

        IntConsumer evenDeleteWorker = wId -> {
            if (wId >= scanThread) {
                scanProc.accept(wId);
            } else if (wId >= readThread) {
                readProc.accept(wId);
            } else if (wId % 2 == 0) {
                deleteProc.accept(wId);
            } else {
                writeProc.accept(wId);
            }
        };

        IntConsumer oddDeleteWorker = wId -> {
            if (wId >= scanThread) {
                scanProc.accept(wId);
            } else if (wId >= readThread) {
                readProc.accept(wId);
            } else if (wId % 2 == 0) {
                writeProc.accept(wId);
            } else {
                deleteProc.accept(wId);
            }
        };

        this.barrier.runAll(initWorker);
        for (int i = 0; i < this.params.repeatNum(); i++) {
            finishedMutators.set(0);
            this.barrier.runAll(evenDeleteWorker);
            finishedMutators.set(0);
            this.barrier.runAll(oddDeleteWorker);
            logger.debug("Concurrent SMO repetition {} done", i);
        }
    }

    /**
     * Build the worker's ids, then wait for the start signal. Every worker must
     * go through here (or call {@link StartBarrier#awaitRelease()} directly)
     * before touching the index.
     */
    private List<Integer> targetIdsAndWait(int wId, AccessPattern pattern) {
        List<Integer> ids = this.generator.targetIds(wId, pattern);
        this.barrier.awaitRelease();
        return ids;
    }

    private List<Integer> smoTargetIdsAndWait() {
        List<Integer> ids = this.generator.targetIdsForConcurrentSmos();
        this.barrier.awaitRelease();
        return ids;
    }
}
