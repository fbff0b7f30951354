package edu.yu.idxcheck.epoch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pins one epoch for as long as it is open. Closing is idempotent.
 */
public final class EpochGuard implements AutoCloseable {

    private final EpochManager manager;
    private final long epoch;
    private final AtomicBoolean released;

    EpochGuard(EpochManager manager, long epoch) {
        this.manager = manager;
        this.epoch = epoch;
        this.released = new AtomicBoolean();
    }

    /**
     * @return the pinned epoch
     */
    public long epoch() {
        return this.epoch;
    }

    public boolean isActive() {
        return !this.released.get();
    }

    /**
     * @throws IllegalStateException if the guard was already closed
     */
    public void checkActive() {
        if (this.released.get()) {
            throw new IllegalStateException("Epoch guard for epoch " + this.epoch + " was already released");
        }
    }

    @Override
    public void close() {
        if (this.released.compareAndSet(false, true)) {
            this.manager.unpin(this.epoch);
        }
    }

    @Override
    public String toString() {
        return "EpochGuard: [epoch: " + this.epoch + ", active: " + isActive() + "]";
    }
}
