package edu.yu.idxcheck.harness;

import java.util.List;

/**
 * Thrown after a barrier round when one or more workers ended with an
 * exception. The first failure is the cause; the rest are suppressed.
 */
public class WorkerFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<Throwable> failures;

    public WorkerFailureException(String message, List<Throwable> failures) {
        super(message, failures.isEmpty() ? null : failures.get(0));

        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i));
        }
    }

    /**
     * @return every worker failure in worker order
     */
    public List<Throwable> failures() {
        return this.failures;
    }
}
