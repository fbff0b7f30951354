package edu.yu.idxcheck.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Deterministic per-worker id sequences. Worker {@code w} owns the ids
 * {@code threadNum * k + w} for {@code k} in {@code [1, execNum]}, so no two
 * workers share an id. Shuffles and samples use a fresh {@link Random} seeded
 * with the configured seed on every call.
 */
public class AccessPatternGenerator {

    private final int threadNum;
    private final int execNum;
    private final long seed;

    public AccessPatternGenerator(int threadNum, int execNum, long seed) {
        if (threadNum <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        if (execNum <= 0) {
            throw new IllegalArgumentException("Exec count must be positive");
        }

        this.threadNum = threadNum;
        this.execNum = execNum;
        this.seed = seed;
    }

    public AccessPatternGenerator(HarnessParameters params) {
        this(params.threadNum(), params.execNum(), params.randomSeed());
    }

    /**
     * @param wId     the worker id in {@code [0, threadNum)}
     * @param pattern
     * @return the worker's ids in the pattern's order
     */
    public List<Integer> targetIds(int wId, AccessPattern pattern) {
        if (wId < 0 || wId >= this.threadNum) {
            throw new IllegalArgumentException("Worker id out of range: " + wId);
        }
        if (pattern == null) {
            throw new IllegalArgumentException("Access pattern can't be null");
        }

        List<Integer> ids = new ArrayList<>(this.execNum);
        if (pattern == AccessPattern.REVERSE) {
            for (int k = this.execNum; k > 0; k--) {
                ids.add(this.threadNum * k + wId);
            }
        } else {
            for (int k = 1; k <= this.execNum; k++) {
                ids.add(this.threadNum * k + wId);
            }
        }

        if (pattern == AccessPattern.RANDOM) {
            Collections.shuffle(ids, new Random(this.seed));
        }

        return ids;
    }

    /**
     * @param n
     * @return {@code 0, 1, ..., n - 1}
     */
    public List<Integer> sequentialIds(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Id count must be >= 0");
        }

        List<Integer> ids = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ids.add(i);
        }
        return ids;
    }

    /**
     * Sample {@code execNum} ids of the form
     * {@code threadNum * U(1, execNum) + U(0, threadNum / 2 - 1)}, i.e. only ids
     * owned by the lower half of the workers.
     *
     * @return the sampled ids, possibly with repeats
     */
    public List<Integer> targetIdsForConcurrentSmos() {
        if (this.threadNum < 2) {
            throw new IllegalStateException("Concurrent SMO ids need at least two workers");
        }

        Random rng = new Random(this.seed);
        int writerSlots = this.threadNum / 2;
        List<Integer> ids = new ArrayList<>(this.execNum);
        for (int i = 0; i < this.execNum; i++) {
            int round = 1 + rng.nextInt(this.execNum);
            int slot = rng.nextInt(writerSlots);
            ids.add(this.threadNum * round + slot);
        }
        return ids;
    }
}
