package edu.yu.idxcheck.harness;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.idxcheck.data.DataType;
import edu.yu.idxcheck.epoch.EpochManager;
import edu.yu.idxcheck.index.Capability;
import edu.yu.idxcheck.index.IndexUnderTest;

/**
 * Runs named scenarios end to end: capability check, fresh epoch manager and
 * index, test data, the scenario's phases, teardown. Every scenario returns a
 * {@link ScenarioResult}; violations and worker failures never escape as
 * exceptions.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public class ScenarioOrchestrator<K, V> {

    private static final Logger logger = LogManager.getLogger(ScenarioOrchestrator.class);

    private final HarnessParameters params;
    private final DataType<K> keyType;
    private final DataType<V> payloadType;
    private final IndexFactory<K, V> indexFactory;

    public ScenarioOrchestrator(HarnessParameters params, DataType<K> keyType, DataType<V> payloadType,
            IndexFactory<K, V> indexFactory) {
        if (params == null || indexFactory == null) {
            throw new IllegalArgumentException("Parameters and index factory can't be null");
        }
        if (keyType == null || payloadType == null) {
            throw new IllegalArgumentException("Data types can't be null");
        }

        this.params = params;
        this.keyType = keyType;
        this.payloadType = payloadType;
        this.indexFactory = indexFactory;
    }

    public HarnessParameters params() {
        return this.params;
    }

    /*
     * Compositions
     */

    public ScenarioResult verifyWritesWith(boolean writeTwice, boolean withDelete, AccessPattern pattern) {
        Set<Capability> required = EnumSet.of(Capability.WRITE);
        if (withDelete) {
            required.add(Capability.DELETE);
        }

        String name = String.format("WritesWith(writeTwice=%b, withDelete=%b, %s)", writeTwice, withDelete,
                pattern);
        boolean expectSuccess = !withDelete || writeTwice;

        return run(name, required, phases -> {
            phases.verifyWrite(false, pattern);
            if (withDelete) {
                phases.verifyDelete(true, pattern);
            }
            if (writeTwice) {
                phases.verifyWrite(true, pattern);
            }
            phases.verifyRead(expectSuccess, writeTwice, pattern);
            phases.verifyScan(expectSuccess, writeTwice);
        });
    }

    public ScenarioResult verifyInsertsWith(boolean writeTwice, boolean withDelete, AccessPattern pattern) {
        Set<Capability> required = EnumSet.of(Capability.INSERT);
        if (withDelete) {
            required.add(Capability.DELETE);
        }

        String name = String.format("InsertsWith(writeTwice=%b, withDelete=%b, %s)", writeTwice, withDelete,
                pattern);
        boolean expectSuccess = !withDelete || writeTwice;
        boolean isUpdated = withDelete && writeTwice;

        return run(name, required, phases -> {
            phases.verifyInsert(true, false, pattern);
            if (withDelete) {
                phases.verifyDelete(true, pattern);
            }
            if (writeTwice) {
                // a second insert only succeeds where the delete removed the key
                phases.verifyInsert(withDelete, true, pattern);
            }
            phases.verifyRead(expectSuccess, isUpdated, pattern);
            phases.verifyScan(expectSuccess, isUpdated);
        });
    }

    public ScenarioResult verifyUpdatesWith(boolean withWrite, boolean withDelete, AccessPattern pattern) {
        Set<Capability> required = EnumSet.of(Capability.UPDATE);
        if (withWrite) {
            required.add(Capability.WRITE);
        }
        if (withDelete) {
            required.add(Capability.DELETE);
        }

        String name = String.format("UpdatesWith(withWrite=%b, withDelete=%b, %s)", withWrite, withDelete,
                pattern);
        boolean expectSuccess = withWrite && !withDelete;

        return run(name, required, phases -> {
            if (withWrite) {
                phases.verifyWrite(false, pattern);
            }
            if (withDelete) {
                phases.verifyDelete(withWrite, pattern);
            }
            phases.verifyUpdate(expectSuccess, pattern);
            phases.verifyRead(expectSuccess, true, pattern);
            phases.verifyScan(expectSuccess, true);
        });
    }

    public ScenarioResult verifyDeletesWith(boolean withWrite, boolean withDelete, AccessPattern pattern) {
        Set<Capability> required = EnumSet.of(Capability.DELETE);
        if (withWrite) {
            required.add(Capability.WRITE);
        }

        String name = String.format("DeletesWith(withWrite=%b, withDelete=%b, %s)", withWrite, withDelete,
                pattern);
        boolean expectSuccess = withWrite && !withDelete;

        return run(name, required, phases -> {
            if (withWrite) {
                phases.verifyWrite(false, pattern);
            }
            if (withDelete) {
                phases.verifyDelete(withWrite, pattern);
            }
            phases.verifyDelete(expectSuccess, pattern);
            phases.verifyRead(false, false, pattern);
            phases.verifyScan(false, false);
        });
    }

    public ScenarioResult verifyBulkloadWith(WriteOperation writeOps, AccessPattern pattern) {
        Set<Capability> required = EnumSet.of(Capability.BULKLOAD);
        required.addAll(writeOps.requiredCapabilities());

        String name = String.format("BulkloadWith(%s, %s)", writeOps, pattern);
        boolean expectSuccess = writeOps != WriteOperation.DELETE;
        boolean isUpdated = writeOps == WriteOperation.WRITE || writeOps == WriteOperation.UPDATE;

        return run(name, required, phases -> {
            phases.verifyBulkload();
            switch (writeOps) {
                case WRITE -> phases.verifyWrite(true, pattern);
                case INSERT -> phases.verifyInsert(false, true, pattern);
                case UPDATE -> phases.verifyUpdate(true, pattern);
                case DELETE -> phases.verifyDelete(true, pattern);
                case NONE -> {
                }
            }
            phases.verifyRead(expectSuccess, isUpdated, pattern);
            phases.verifyScan(expectSuccess, isUpdated);
        });
    }

    public ScenarioResult verifySnapshotRead() {
        return run("SnapshotRead", EnumSet.of(Capability.WRITE), ScenarioPhases::verifySnapshotRead);
    }

    /**
     * @throws IllegalArgumentException for {@link WriteOperation#INSERT}
     */
    public ScenarioResult verifySnapshotScanWith(WriteOperation writeOps, AccessPattern pattern) {
        if (writeOps == WriteOperation.INSERT) {
            throw new IllegalArgumentException("Snapshot scans can't run alongside inserts");
        }

        Set<Capability> required = EnumSet.of(Capability.WRITE, Capability.SCAN);
        required.addAll(writeOps.requiredCapabilities());

        String name = String.format("SnapshotScanWith(%s, %s)", writeOps, pattern);
        return run(name, required, phases -> phases.verifySnapshotScanWith(writeOps, pattern));
    }

    public ScenarioResult verifyConcurrentSmos() {
        String name = "ConcurrentSmos";
        if (this.params.threadNum() % 4 != 0) {
            logger.warn("Skipping {}: thread count {} is not divisible by 4", name, this.params.threadNum());
            return ScenarioResult.skipped(name, "thread count not divisible by 4");
        }

        Set<Capability> required = EnumSet.of(Capability.WRITE, Capability.DELETE, Capability.SCAN);
        return run(name, required, ScenarioPhases::verifyConcurrentSmos);
    }

    /**
     * Run an ad hoc composition of phases with the same lifecycle as the named
     * scenarios.
     */
    public ScenarioResult runCustom(String name, Set<Capability> required, Consumer<ScenarioPhases<K, V>> body) {
        if (name == null || required == null || body == null) {
            throw new IllegalArgumentException("Scenario name, capabilities and body can't be null");
        }

        return run(name, required, body);
    }

    private ScenarioResult run(String name, Set<Capability> required, Consumer<ScenarioPhases<K, V>> body) {
        Set<Capability> missing = this.indexFactory.capabilities().missing(required);
        if (!missing.isEmpty()) {
            logger.warn("Skipping {}: index lacks {}", name, missing);
            return ScenarioResult.skipped(name, missing);
        }

        logger.info("Starting {} with {}", name, this.params);
        long start = System.nanoTime();
        ViolationCollector violations = new ViolationCollector(name);

        EpochManager epochManager = new EpochManager();
        List<K> keys = this.keyType.prepare(this.params.keyNum());
        List<V> payloads = this.payloadType.prepare(this.params.threadNum() * 2);

        try (IndexUnderTest<K, V> index = this.indexFactory.create(epochManager, this.params)) {
            CapabilityGate gate = new CapabilityGate(index.capabilities());
            ScenarioPhases<K, V> phases = new ScenarioPhases<>(this.params, gate,
                    new StartBarrier(this.params.threadNum(), this.params.settleMillis()),
                    new AccessPatternGenerator(this.params),
                    new OperationDriver<>(index, gate, this.keyType, this.payloadType, keys, payloads),
                    new EpochCoordinator(epochManager),
                    new Oracle<>(this.params.threadNum(), this.keyType, this.payloadType, keys, payloads,
                            violations));

            body.accept(phases);
        } catch (WorkerFailureException e) {
            for (Throwable failure : e.failures()) {
                violations.record("worker failed: %s", failure);
            }
        } catch (RuntimeException e) {
            logger.error("Scenario {} aborted", name, e);
            violations.record("scenario aborted: %s", e);
        } finally {
            this.keyType.release(keys);
            this.payloadType.release(payloads);
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        ScenarioResult result = ScenarioResult.completed(name, violations.snapshot(), elapsedMillis);
        logger.info("{}", result);
        return result;
    }
}
