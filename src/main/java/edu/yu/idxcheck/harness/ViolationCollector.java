package edu.yu.idxcheck.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thread-safe sink for correctness violations found during one scenario.
 * Recording never throws, so a scenario always runs to its end and reports
 * every mismatch.
 */
public class ViolationCollector {

    private static final Logger logger = LogManager.getLogger(ViolationCollector.class);

    private final String scenario;
    private final ConcurrentLinkedQueue<String> violations;

    public ViolationCollector(String scenario) {
        this.scenario = scenario;
        this.violations = new ConcurrentLinkedQueue<>();
    }

    /**
     * @param format a {@link String#format} pattern
     * @param args
     */
    public void record(String format, Object... args) {
        String message = String.format(format, args);
        this.violations.add(message);
        logger.error("[{}] {}", this.scenario, message);
    }

    public boolean isEmpty() {
        return this.violations.isEmpty();
    }

    public int count() {
        return this.violations.size();
    }

    /**
     * @return a copy of the violations recorded so far
     */
    public List<String> snapshot() {
        return new ArrayList<>(this.violations);
    }
}
