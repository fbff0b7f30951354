package edu.yu.idxcheck.harness;

import edu.yu.idxcheck.config.HarnessConfiguration;

/**
 * Immutable sizing and timing constants for one harness run.
 */
public final class HarnessParameters {

    private final int threadNum;
    private final int execNum;
    private final long randomSeed;
    private final long settleMillis;
    private final long epochIntervalMicros;
    private final int repeatNum;

    public HarnessParameters(int threadNum, int execNum, long randomSeed, long settleMillis,
            long epochIntervalMicros, int repeatNum) {
        if (threadNum <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        if (execNum < threadNum) {
            // per-worker scan ranges are [threadNum + execNum * w, execNum * (w + 1)), empty when equal
            throw new IllegalArgumentException("Exec count can't be less than the thread count");
        }
        if (settleMillis < 0) {
            throw new IllegalArgumentException("Settle interval must be >= 0");
        }
        if (epochIntervalMicros < 0) {
            throw new IllegalArgumentException("Epoch interval must be >= 0");
        }
        if (repeatNum <= 0) {
            throw new IllegalArgumentException("Repeat count must be positive");
        }
        if ((long) (execNum + 2) * threadNum > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Key universe doesn't fit in an int");
        }

        this.threadNum = threadNum;
        this.execNum = execNum;
        this.randomSeed = randomSeed;
        this.settleMillis = settleMillis;
        this.epochIntervalMicros = epochIntervalMicros;
        this.repeatNum = repeatNum;
    }

    /**
     * Snapshot the values currently held by {@link HarnessConfiguration}.
     *
     * @return the parameters in effect
     */
    public static HarnessParameters fromConfiguration() {
        HarnessConfiguration config = HarnessConfiguration.INSTANCE;
        return new HarnessParameters(
                config.threadNum(),
                config.execNum(),
                config.randomSeed(),
                config.settleMillis(),
                config.epochIntervalMicros(),
                config.repeatNum());
    }

    public int threadNum() {
        return this.threadNum;
    }

    public int execNum() {
        return this.execNum;
    }

    /**
     * @return the size of the id universe, {@code (execNum + 2) * threadNum}
     */
    public int keyNum() {
        return (this.execNum + 2) * this.threadNum;
    }

    public long randomSeed() {
        return this.randomSeed;
    }

    public long settleMillis() {
        return this.settleMillis;
    }

    public long epochIntervalMicros() {
        return this.epochIntervalMicros;
    }

    public int repeatNum() {
        return this.repeatNum;
    }

    @Override
    public String toString() {
        return new StringBuilder()
                .append("HarnessParameters: [threadNum: ")
                .append(this.threadNum)
                .append(", execNum: ")
                .append(this.execNum)
                .append(", keyNum: ")
                .append(keyNum())
                .append(", seed: ")
                .append(this.randomSeed)
                .append(", settleMillis: ")
                .append(this.settleMillis)
                .append(", epochIntervalMicros: ")
                .append(this.epochIntervalMicros)
                .append(", repeatNum: ")
                .append(this.repeatNum)
                .append("]")
                .toString();
    }
}
