package edu.yu.idxcheck.harness;

import edu.yu.idxcheck.epoch.EpochManager;
import edu.yu.idxcheck.index.Capabilities;
import edu.yu.idxcheck.index.IndexUnderTest;

/**
 * Creates a fresh index for every scenario.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public interface IndexFactory<K, V> {

    /**
     * Queried before any data is prepared, so a scenario can be skipped without
     * building an index. Must match what {@link #create} returns.
     */
    Capabilities capabilities();

    IndexUnderTest<K, V> create(EpochManager epochManager, HarnessParameters params);
}
