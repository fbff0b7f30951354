package edu.yu.idxcheck.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.IntUnaryOperator;

import edu.yu.idxcheck.data.DataType;
import edu.yu.idxcheck.epoch.EpochGuard;
import edu.yu.idxcheck.epoch.ProtectedEpochs;
import edu.yu.idxcheck.index.IndexEntry;
import edu.yu.idxcheck.index.IndexUnderTest;
import edu.yu.idxcheck.index.ScanKey;

/**
 * Translates key/payload ids into calls on the index under test. A call whose
 * capability is missing does nothing and returns {@link #NEUTRAL} (or an empty
 * iterator), so scenario code stays the same for every index.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public class OperationDriver<K, V> {

    public static final int NEUTRAL = IndexUnderTest.SUCCESS;

    private final IndexUnderTest<K, V> index;
    private final CapabilityGate gate;
    private final DataType<K> keyType;
    private final DataType<V> payloadType;
    private final List<K> keys;
    private final List<V> payloads;

    public OperationDriver(IndexUnderTest<K, V> index, CapabilityGate gate, DataType<K> keyType,
            DataType<V> payloadType, List<K> keys, List<V> payloads) {
        if (index == null || gate == null) {
            throw new IllegalArgumentException("Index and gate can't be null");
        }
        if (keyType == null || payloadType == null) {
            throw new IllegalArgumentException("Data types can't be null");
        }
        if (keys == null || payloads == null) {
            throw new IllegalArgumentException("Test data can't be null");
        }

        this.index = index;
        this.gate = gate;
        this.keyType = keyType;
        this.payloadType = payloadType;
        this.keys = keys;
        this.payloads = payloads;
    }

    public int write(int keyId, int payId) {
        if (!this.gate.hasWrite()) {
            return NEUTRAL;
        }

        K key = key(keyId);
        V payload = payload(payId);
        return this.index.write(key, payload, this.keyType.length(key), this.payloadType.length(payload));
    }

    public int insert(int keyId, int payId) {
        if (!this.gate.hasInsert()) {
            return NEUTRAL;
        }

        K key = key(keyId);
        V payload = payload(payId);
        return this.index.insert(key, payload, this.keyType.length(key), this.payloadType.length(payload));
    }

    public int update(int keyId, int payId) {
        if (!this.gate.hasUpdate()) {
            return NEUTRAL;
        }

        K key = key(keyId);
        V payload = payload(payId);
        return this.index.update(key, payload, this.keyType.length(key), this.payloadType.length(payload));
    }

    public int delete(int keyId) {
        if (!this.gate.hasDelete()) {
            return NEUTRAL;
        }

        K key = key(keyId);
        return this.index.delete(key, this.keyType.length(key));
    }

    public Optional<V> read(int keyId) {
        K key = key(keyId);
        return this.index.read(key, this.keyType.length(key));
    }

    public Optional<V> snapshotRead(int keyId, ProtectedEpochs protectedEpochs) {
        K key = key(keyId);
        return this.index.snapshotRead(key, protectedEpochs.guard(), protectedEpochs.epochs(),
                this.keyType.length(key));
    }

    /**
     * Scan the latest state of {@code [beginId, endId)}.
     */
    public Iterator<IndexEntry<K, V>> scan(int beginId, int endId) {
        if (!this.gate.hasScan()) {
            return Collections.emptyIterator();
        }

        return this.index.scan(beginKey(beginId), endKey(endId));
    }

    /**
     * Scan {@code [beginId, endId)} as of the snapshot held by
     * {@code protectedEpochs}.
     */
    public Iterator<IndexEntry<K, V>> scan(ProtectedEpochs protectedEpochs, int beginId, int endId) {
        if (!this.gate.hasScan()) {
            return Collections.emptyIterator();
        }

        return this.index.scan(protectedEpochs.guard(), protectedEpochs.epochs(), beginKey(beginId),
                endKey(endId));
    }

    /**
     * Scan everything as of the guard's snapshot.
     */
    public Iterator<IndexEntry<K, V>> scan(EpochGuard guard) {
        if (!this.gate.hasScan()) {
            return Collections.emptyIterator();
        }

        return this.index.scan(guard);
    }

    public int bulkload(List<IndexEntry<K, V>> entries, int parallelism) {
        if (!this.gate.hasBulkload()) {
            return NEUTRAL;
        }

        return this.index.bulkload(entries, parallelism);
    }

    /**
     * Build bulkload entries for key ids {@code [beginId, endId)}, each carrying
     * the payload chosen by {@code payloadIdOf}.
     */
    public List<IndexEntry<K, V>> entries(int beginId, int endId, IntUnaryOperator payloadIdOf) {
        List<IndexEntry<K, V>> entries = new ArrayList<>(Math.max(0, endId - beginId));
        for (int id = beginId; id < endId; id++) {
            K key = key(id);
            V payload = payload(payloadIdOf.applyAsInt(id));
            entries.add(new IndexEntry<>(key, payload, this.keyType.length(key), this.payloadType.length(payload)));
        }
        return entries;
    }

    public K key(int keyId) {
        return this.keys.get(keyId);
    }

    public V payload(int payId) {
        return this.payloads.get(payId);
    }

    private ScanKey<K> beginKey(int beginId) {
        K key = key(beginId);
        return ScanKey.closed(key, this.keyType.length(key));
    }

    private ScanKey<K> endKey(int endId) {
        K key = key(endId);
        return ScanKey.open(key, this.keyType.length(key));
    }
}
