package edu.yu.idxcheck.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The standard scenario matrix: every composition under every access pattern,
 * then the snapshot scenarios and the concurrent SMO stress test.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public class ScenarioCatalog<K, V> {

    private static final Logger logger = LogManager.getLogger(ScenarioCatalog.class);

    private static final WriteOperation[] SNAPSHOT_SCAN_OPERATIONS = { WriteOperation.NONE, WriteOperation.WRITE,
            WriteOperation.UPDATE, WriteOperation.DELETE };

    private final ScenarioOrchestrator<K, V> orchestrator;
    private final List<Supplier<ScenarioResult>> scenarios;

    public ScenarioCatalog(ScenarioOrchestrator<K, V> orchestrator) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("Orchestrator can't be null");
        }

        this.orchestrator = orchestrator;
        this.scenarios = new ArrayList<>();
        registerStandardMatrix();
    }

    /**
     * @return the number of scenarios {@link #runAll()} executes
     */
    public int size() {
        return this.scenarios.size();
    }

    /**
     * Run every scenario in registration order.
     *
     * @return one result per scenario, in the same order
     */
    public List<ScenarioResult> runAll() {
        logger.info("Running {} scenarios with {}", this.scenarios.size(), this.orchestrator.params());

        List<ScenarioResult> results = new ArrayList<>(this.scenarios.size());
        for (Supplier<ScenarioResult> scenario : this.scenarios) {
            results.add(scenario.get());
        }

        int passed = 0;
        int failed = 0;
        int skipped = 0;
        for (ScenarioResult result : results) {
            switch (result.outcome()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }

        if (failed > 0) {
            logger.error("{} passed, {} failed, {} skipped", passed, failed, skipped);
            for (ScenarioResult result : results) {
                if (result.failed()) {
                    logger.error("  {}", result);
                }
            }
        } else {
            logger.info("{} passed, {} failed, {} skipped", passed, failed, skipped);
        }
        return results;
    }

    private void registerStandardMatrix() {
        boolean[] flags = { false, true };

        for (AccessPattern pattern : AccessPattern.values()) {
            for (boolean first : flags) {
                for (boolean second : flags) {
                    this.scenarios.add(() -> this.orchestrator.verifyWritesWith(first, second, pattern));
                    this.scenarios.add(() -> this.orchestrator.verifyInsertsWith(first, second, pattern));
                    this.scenarios.add(() -> this.orchestrator.verifyUpdatesWith(first, second, pattern));
                    this.scenarios.add(() -> this.orchestrator.verifyDeletesWith(first, second, pattern));
                }
            }
            for (WriteOperation writeOps : WriteOperation.values()) {
                this.scenarios.add(() -> this.orchestrator.verifyBulkloadWith(writeOps, pattern));
            }
        }

        this.scenarios.add(this.orchestrator::verifySnapshotRead);
        for (AccessPattern pattern : AccessPattern.values()) {
            for (WriteOperation writeOps : SNAPSHOT_SCAN_OPERATIONS) {
                this.scenarios.add(() -> this.orchestrator.verifySnapshotScanWith(writeOps, pattern));
            }
        }

        this.scenarios.add(this.orchestrator::verifyConcurrentSmos);
    }
}
