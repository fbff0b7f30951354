package edu.yu.idxcheck.epoch;

import java.util.List;

/**
 * A pinned guard together with the epochs that were protected when it was
 * taken, newest first. Closing releases the guard.
 */
public final class ProtectedEpochs implements AutoCloseable {

    private final EpochGuard guard;
    private final List<Long> epochs;

    ProtectedEpochs(EpochGuard guard, List<Long> epochs) {
        this.guard = guard;
        this.epochs = epochs;
    }

    public EpochGuard guard() {
        return this.guard;
    }

    /**
     * @return an unmodifiable, descending list starting with the guard's epoch
     */
    public List<Long> epochs() {
        return this.epochs;
    }

    @Override
    public void close() {
        this.guard.close();
    }

    @Override
    public String toString() {
        return "ProtectedEpochs: [guard: " + this.guard + ", epochs: " + this.epochs + "]";
    }
}
