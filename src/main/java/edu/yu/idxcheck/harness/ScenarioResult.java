package edu.yu.idxcheck.harness;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import edu.yu.idxcheck.index.Capability;

/**
 * The outcome of one named scenario.
 */
public final class ScenarioResult {

    public enum Outcome {
        PASSED, FAILED, SKIPPED
    }

    private final String name;
    private final Outcome outcome;
    private final List<String> violations;
    private final String skipReason;
    private final long elapsedMillis;

    private ScenarioResult(String name, Outcome outcome, List<String> violations, String skipReason,
            long elapsedMillis) {
        this.name = name;
        this.outcome = outcome;
        this.violations = Collections.unmodifiableList(violations);
        this.skipReason = skipReason;
        this.elapsedMillis = elapsedMillis;
    }

    public static ScenarioResult skipped(String name, Set<Capability> missing) {
        return new ScenarioResult(name, Outcome.SKIPPED, List.of(), "missing capabilities " + missing, 0);
    }

    public static ScenarioResult skipped(String name, String reason) {
        return new ScenarioResult(name, Outcome.SKIPPED, List.of(), reason, 0);
    }

    /**
     * PASSED when {@code violations} is empty, FAILED otherwise.
     */
    public static ScenarioResult completed(String name, List<String> violations, long elapsedMillis) {
        Outcome outcome = violations.isEmpty() ? Outcome.PASSED : Outcome.FAILED;
        return new ScenarioResult(name, outcome, List.copyOf(violations), null, elapsedMillis);
    }

    public String name() {
        return this.name;
    }

    public Outcome outcome() {
        return this.outcome;
    }

    public boolean passed() {
        return this.outcome == Outcome.PASSED;
    }

    public boolean failed() {
        return this.outcome == Outcome.FAILED;
    }

    public boolean skipped() {
        return this.outcome == Outcome.SKIPPED;
    }

    public List<String> violations() {
        return this.violations;
    }

    /**
     * @return why the scenario was skipped, or null if it ran
     */
    public String skipReason() {
        return this.skipReason;
    }

    public long elapsedMillis() {
        return this.elapsedMillis;
    }

    @Override
    public String toString() {
        return switch (this.outcome) {
            case PASSED -> String.format("%s PASSED in %d ms", this.name, this.elapsedMillis);
            case FAILED -> String.format("%s FAILED in %d ms with %d violation(s)", this.name, this.elapsedMillis,
                    this.violations.size());
            case SKIPPED -> String.format("%s SKIPPED (%s)", this.name, this.skipReason);
        };
    }
}
