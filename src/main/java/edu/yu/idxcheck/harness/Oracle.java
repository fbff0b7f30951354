package edu.yu.idxcheck.harness;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import edu.yu.idxcheck.data.DataType;
import edu.yu.idxcheck.index.IndexEntry;

/**
 * Computes expected results and compares them with what the index returned.
 * <p>
 * Payload convention: worker {@code w} writes payload {@code w} on its first
 * write and {@code w + threadNum} on an updating write, and worker {@code w}
 * owns every key id congruent to {@code w} modulo {@code threadNum}. Expected
 * payloads therefore follow from the key id and whether an update ran.
 * <p>
 * Mismatches go to the {@link ViolationCollector}; nothing here throws.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public class Oracle<K, V> {

    private final int threadNum;
    private final DataType<K> keyType;
    private final DataType<V> payloadType;
    private final List<K> keys;
    private final List<V> payloads;
    private final ViolationCollector violations;

    public Oracle(int threadNum, DataType<K> keyType, DataType<V> payloadType, List<K> keys, List<V> payloads,
            ViolationCollector violations) {
        if (threadNum <= 0) {
            throw new IllegalArgumentException("Thread count must be positive");
        }
        if (keyType == null || payloadType == null || keys == null || payloads == null || violations == null) {
            throw new IllegalArgumentException("Oracle inputs can't be null");
        }

        this.threadNum = threadNum;
        this.keyType = keyType;
        this.payloadType = payloadType;
        this.keys = keys;
        this.payloads = payloads;
        this.violations = violations;
    }

    public int payloadIdFor(int wId, boolean isUpdate) {
        return isUpdate ? wId + this.threadNum : wId;
    }

    public int payloadIdForKey(int keyId, boolean isUpdate) {
        return payloadIdFor(keyId % this.threadNum, isUpdate);
    }

    public void checkResultCode(String operation, int keyId, int rc, boolean expectSuccess) {
        if (expectSuccess && rc != 0) {
            this.violations.record("%s of key id %d failed with code %d", operation, keyId, rc);
        } else if (!expectSuccess && rc == 0) {
            this.violations.record("%s of key id %d succeeded but was expected to fail", operation, keyId);
        }
    }

    public void checkRead(int keyId, Optional<V> actual, boolean expectSuccess, int expectedPayId) {
        if (!expectSuccess) {
            if (actual.isPresent()) {
                this.violations.record("read of key id %d found payload %s but the key should be absent", keyId,
                        this.payloadType.render(actual.get()));
            }
            return;
        }

        if (actual.isEmpty()) {
            this.violations.record("read of key id %d found nothing, expected payload id %d", keyId, expectedPayId);
        } else if (!this.payloadType.isEqual(payload(expectedPayId), actual.get())) {
            this.violations.record("read of key id %d returned %s, expected %s", keyId,
                    this.payloadType.render(actual.get()), this.payloadType.render(payload(expectedPayId)));
        }
    }

    /**
     * A snapshot read must return the payload visible when the snapshot was
     * taken, whatever has been written since.
     */
    public void checkSnapshotRead(int keyId, Optional<V> actual, int expectedPayId) {
        if (actual.isEmpty()) {
            this.violations.record("snapshot read of key id %d found nothing, expected payload id %d", keyId,
                    expectedPayId);
        } else if (!this.payloadType.isEqual(payload(expectedPayId), actual.get())) {
            this.violations.record("snapshot read of key id %d returned %s, expected pre-snapshot payload %s",
                    keyId, this.payloadType.render(actual.get()), this.payloadType.render(payload(expectedPayId)));
        }
    }

    /**
     * Walk a scan of {@code [beginId, endId)} in lockstep with an expected-id
     * cursor. With {@code expectSuccess} every id in the range must appear once,
     * in order, with the expected payload; otherwise the scan must be empty.
     *
     * @return the cursor position reached
     */
    public int checkRangeScan(Iterator<IndexEntry<K, V>> iter, int beginId, int endId, boolean expectSuccess,
            boolean isUpdate) {
        int cursor = beginId;
        if (expectSuccess) {
            while (iter.hasNext()) {
                IndexEntry<K, V> entry = iter.next();
                if (cursor >= endId || cursor >= this.keys.size()) {
                    this.violations.record("scan of [%d, %d) returned extra key %s", beginId, endId,
                            this.keyType.render(entry.key()));
                    cursor++;
                    continue;
                }

                K expectedKey = this.keys.get(cursor);
                if (!this.keyType.isEqual(expectedKey, entry.key())) {
                    this.violations.record("scan of [%d, %d) returned key %s at id %d, expected %s", beginId, endId,
                            this.keyType.render(entry.key()), cursor, this.keyType.render(expectedKey));
                }

                V expectedPayload = payload(payloadIdForKey(cursor, isUpdate));
                if (!this.payloadType.isEqual(expectedPayload, entry.payload())) {
                    this.violations.record("scan of [%d, %d) returned payload %s at id %d, expected %s", beginId,
                            endId, this.payloadType.render(entry.payload()), cursor,
                            this.payloadType.render(expectedPayload));
                }
                cursor++;
            }

            if (cursor != endId) {
                this.violations.record("scan of [%d, %d) stopped at id %d", beginId, endId, cursor);
            }
        }

        if (iter.hasNext()) {
            this.violations.record("scan of [%d, %d) still has entries, first is key %s", beginId, endId,
                    this.keyType.render(iter.next().key()));
        }

        return cursor;
    }

    /**
     * Under concurrent insert/delete a read may miss, but a hit must carry the
     * one payload ever written for that key id.
     */
    public void checkConcurrentRead(int keyId, Optional<V> actual) {
        if (actual.isEmpty()) {
            return;
        }

        V expected = payload(payloadIdForKey(keyId, false));
        if (!this.payloadType.isEqual(expected, actual.get())) {
            this.violations.record("concurrent read of key id %d returned %s, expected %s or nothing", keyId,
                    this.payloadType.render(actual.get()), this.payloadType.render(expected));
        }
    }

    /**
     * Record a violation when a generated target id has no prepared key.
     *
     * @return true if {@code keyId} can be read
     */
    public boolean checkInKeyUniverse(int keyId) {
        if (keyId < 0 || keyId >= this.keys.size()) {
            this.violations.record("read target id %d is outside the key universe", keyId);
            return false;
        }
        return true;
    }

    /**
     * Check that scan keys strictly increase.
     *
     * @param previous the last key seen
     * @param current  the key just returned
     * @return {@code current}, to become the next {@code previous}
     */
    public K checkAscending(K previous, K current) {
        if (this.keyType.comparator().compare(previous, current) >= 0) {
            this.violations.record("scan returned key %s after %s", this.keyType.render(current),
                    this.keyType.render(previous));
        }
        return current;
    }

    public ViolationCollector violations() {
        return this.violations;
    }

    private V payload(int payId) {
        return this.payloads.get(payId);
    }
}
