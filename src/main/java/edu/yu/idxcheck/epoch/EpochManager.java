package edu.yu.idxcheck.epoch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A process-wide epoch counter plus the set of epochs pinned by live guards.
 * Indexes stamp versions with {@link #currentEpoch()}; a guard pins the epoch
 * that was current when it was created until it is closed.
 */
public class EpochManager {

    private static final Logger logger = LogManager.getLogger(EpochManager.class);

    public static final long INITIAL_EPOCH = 1;

    private final AtomicLong globalEpoch;
    private final ConcurrentHashMap<Long, Integer> pinCounts;

    public EpochManager() {
        this.globalEpoch = new AtomicLong(INITIAL_EPOCH);
        this.pinCounts = new ConcurrentHashMap<>();

        logger.info("Epoch manager started at epoch {}", INITIAL_EPOCH);
    }

    public long currentEpoch() {
        return this.globalEpoch.get();
    }

    /**
     * Advance the global epoch by one.
     *
     * @return the new current epoch
     */
    public long forwardGlobalEpoch() {
        long epoch = this.globalEpoch.incrementAndGet();
        logger.debug("Global epoch forwarded to {}", epoch);
        return epoch;
    }

    /**
     * Pin the current epoch. The pin is registered before the epoch is confirmed
     * as still current, so a concurrent {@link #minProtectedEpoch()} either sees
     * the pin or reads an epoch no newer than the pinned one.
     *
     * @return a guard that must be closed to release the pin
     */
    public EpochGuard createEpochGuard() {
        while (true) {
            long epoch = this.globalEpoch.get();
            pin(epoch);
            if (this.globalEpoch.get() == epoch) {
                return new EpochGuard(this, epoch);
            }

            // forwarded in between, retry on the newer epoch
            unpin(epoch);
        }
    }

    /**
     * Pin the current epoch and list the epochs that must stay readable: the
     * guard's epoch E, E - 1, then every older epoch still pinned by another
     * guard, newest first without duplicates.
     *
     * @return the guard and its protected epoch list
     */
    public ProtectedEpochs getProtectedEpochs() {
        EpochGuard guard = createEpochGuard();
        long current = guard.epoch();

        NavigableSet<Long> older = new TreeSet<>(this.pinCounts.keySet()).headSet(current - 1, false);

        List<Long> epochs = new ArrayList<>(older.size() + 2);
        epochs.add(current);
        epochs.add(current - 1);
        epochs.addAll(older.descendingSet());

        return new ProtectedEpochs(guard, Collections.unmodifiableList(epochs));
    }

    /**
     * The oldest epoch any reader may still observe. Versions that were superseded
     * before this epoch are unreachable.
     *
     * @return the minimum of the current epoch and every pinned epoch
     */
    public long minProtectedEpoch() {
        // read the counter first, see createEpochGuard
        long min = this.globalEpoch.get();
        for (Long pinned : this.pinCounts.keySet()) {
            min = Math.min(min, pinned);
        }
        return min;
    }

    /**
     * @return the number of distinct pinned epochs
     */
    public int pinnedEpochCount() {
        return this.pinCounts.size();
    }

    private void pin(long epoch) {
        this.pinCounts.merge(epoch, 1, Integer::sum);
    }

    void unpin(long epoch) {
        Integer remaining = this.pinCounts.computeIfPresent(epoch, (key, count) -> count == 1 ? null : count - 1);
        logger.trace("Unpinned epoch {} ({} pins left)", epoch, remaining == null ? 0 : remaining);
    }

    @Override
    public String toString() {
        return new StringBuilder()
                .append("EpochManager: [current: ")
                .append(this.globalEpoch.get())
                .append(", pinned: ")
                .append(new TreeSet<>(this.pinCounts.keySet()))
                .append("]")
                .toString();
    }
}
