package edu.yu.idxcheck.index;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import edu.yu.idxcheck.epoch.EpochGuard;

/**
 * The operations a concurrent, epoch-versioned index exposes to the harness.
 * Implementations are shared by every worker thread without external locking
 * and must synchronize internally.
 * <p>
 * Mutations return {@link #SUCCESS} or an implementation-defined nonzero code.
 * Operations outside {@link #capabilities()} may throw
 * {@link UnsupportedOperationException}.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public interface IndexUnderTest<K, V> extends AutoCloseable {

    int SUCCESS = 0;
    int KEY_EXISTS = 1;
    int KEY_NOT_EXIST = 2;

    Capabilities capabilities();

    /**
     * Insert or overwrite.
     */
    default int write(K key, V payload, int keyLength, int payloadLength) {
        throw new UnsupportedOperationException("write");
    }

    /**
     * Insert; fails if the key is present.
     */
    default int insert(K key, V payload, int keyLength, int payloadLength) {
        throw new UnsupportedOperationException("insert");
    }

    /**
     * Overwrite; fails if the key is absent.
     */
    default int update(K key, V payload, int keyLength, int payloadLength) {
        throw new UnsupportedOperationException("update");
    }

    /**
     * Remove; fails if the key is absent.
     */
    default int delete(K key, int keyLength) {
        throw new UnsupportedOperationException("delete");
    }

    Optional<V> read(K key, int keyLength);

    /**
     * Read the payload as of the guard's snapshot, ignoring later mutations.
     */
    Optional<V> snapshotRead(K key, EpochGuard guard, List<Long> protectedEpochs, int keyLength);

    /**
     * Range scan over the latest state in ascending key order. A null end point
     * leaves that side unbounded.
     */
    default Iterator<IndexEntry<K, V>> scan(ScanKey<K> begin, ScanKey<K> end) {
        throw new UnsupportedOperationException("scan");
    }

    /**
     * Range scan over the guard's snapshot.
     */
    default Iterator<IndexEntry<K, V>> scan(EpochGuard guard, List<Long> protectedEpochs, ScanKey<K> begin,
            ScanKey<K> end) {
        throw new UnsupportedOperationException("scan");
    }

    /**
     * Full scan over the guard's snapshot.
     */
    default Iterator<IndexEntry<K, V>> scan(EpochGuard guard) {
        throw new UnsupportedOperationException("scan");
    }

    /**
     * Load entries sorted by key using up to {@code parallelism} threads. Only
     * defined while no other thread mutates the index.
     */
    default int bulkload(List<IndexEntry<K, V>> entries, int parallelism) {
        throw new UnsupportedOperationException("bulkload");
    }

    @Override
    default void close() {
    }
}
