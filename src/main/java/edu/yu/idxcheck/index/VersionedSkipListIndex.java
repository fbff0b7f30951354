package edu.yu.idxcheck.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.idxcheck.epoch.EpochGuard;
import edu.yu.idxcheck.epoch.EpochManager;

/**
 * A multi-version ordered index built on a {@link ConcurrentSkipListMap}.
 * <p>
 * Every key maps to an immutable chain of versions, newest first, each stamped
 * with the global epoch current at the time of the mutation. Deletes push a
 * tombstone. A snapshot bound to a guard at epoch E sees, per key, the newest
 * version stamped strictly before E. Chains are truncated on every mutation
 * below {@link EpochManager#minProtectedEpoch()}.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public class VersionedSkipListIndex<K, V> implements IndexUnderTest<K, V> {

    private static final Logger logger = LogManager.getLogger(VersionedSkipListIndex.class);

    private static final long LATEST = Long.MAX_VALUE;

    private final Comparator<? super K> comparator;
    private final EpochManager epochManager;
    private final Capabilities capabilities;
    private final ConcurrentSkipListMap<K, Version<V>> records;
    private final ScheduledExecutorService epochTicker;

    public VersionedSkipListIndex(Comparator<? super K> comparator, EpochManager epochManager,
            long epochIntervalMicros, Capabilities capabilities) {
        if (comparator == null) {
            throw new IllegalArgumentException("Comparator can't be null");
        }
        if (epochManager == null) {
            throw new IllegalArgumentException("Epoch manager can't be null");
        }
        if (epochIntervalMicros < 0) {
            throw new IllegalArgumentException("Epoch interval must be >= 0");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("Capabilities can't be null");
        }

        this.comparator = comparator;
        this.epochManager = epochManager;
        this.capabilities = capabilities;
        this.records = new ConcurrentSkipListMap<>(comparator);

        // a zero interval leaves epoch forwarding entirely to the caller
        if (epochIntervalMicros > 0) {
            this.epochTicker = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "epoch-ticker");
                thread.setDaemon(true);
                return thread;
            });
            this.epochTicker.scheduleAtFixedRate(epochManager::forwardGlobalEpoch,
                    epochIntervalMicros, epochIntervalMicros, TimeUnit.MICROSECONDS);
        } else {
            this.epochTicker = null;
        }

        logger.debug("Created index with {} and epoch interval {}us", capabilities, epochIntervalMicros);
    }

    public VersionedSkipListIndex(Comparator<? super K> comparator, EpochManager epochManager,
            long epochIntervalMicros) {
        this(comparator, epochManager, epochIntervalMicros, Capabilities.all());
    }

    @Override
    public Capabilities capabilities() {
        return this.capabilities;
    }

    @Override
    public int write(K key, V payload, int keyLength, int payloadLength) {
        requireCapability(Capability.WRITE);
        checkPayload(payload);

        return mutate(key, head -> true, SUCCESS, payload, keyLength, payloadLength);
    }

    @Override
    public int insert(K key, V payload, int keyLength, int payloadLength) {
        requireCapability(Capability.INSERT);
        checkPayload(payload);

        return mutate(key, head -> !isLive(head), KEY_EXISTS, payload, keyLength, payloadLength);
    }

    @Override
    public int update(K key, V payload, int keyLength, int payloadLength) {
        requireCapability(Capability.UPDATE);
        checkPayload(payload);

        return mutate(key, VersionedSkipListIndex::isLive, KEY_NOT_EXIST, payload, keyLength, payloadLength);
    }

    @Override
    public int delete(K key, int keyLength) {
        requireCapability(Capability.DELETE);

        return mutate(key, VersionedSkipListIndex::isLive, KEY_NOT_EXIST, null, keyLength, 0);
    }

    @Override
    public Optional<V> read(K key, int keyLength) {
        checkKey(key);

        Version<V> head = this.records.get(key);
        return isLive(head) ? Optional.of(head.payload) : Optional.empty();
    }

    @Override
    public Optional<V> snapshotRead(K key, EpochGuard guard, List<Long> protectedEpochs, int keyLength) {
        checkKey(key);
        long snapshotEpoch = snapshotEpoch(guard, protectedEpochs);

        Version<V> visible = visibleAt(this.records.get(key), snapshotEpoch);
        return isLive(visible) ? Optional.of(visible.payload) : Optional.empty();
    }

    @Override
    public Iterator<IndexEntry<K, V>> scan(ScanKey<K> begin, ScanKey<K> end) {
        requireCapability(Capability.SCAN);

        return new VisibleEntryIterator(range(begin, end), LATEST, null);
    }

    @Override
    public Iterator<IndexEntry<K, V>> scan(EpochGuard guard, List<Long> protectedEpochs, ScanKey<K> begin,
            ScanKey<K> end) {
        requireCapability(Capability.SCAN);
        long snapshotEpoch = snapshotEpoch(guard, protectedEpochs);

        return new VisibleEntryIterator(range(begin, end), snapshotEpoch, guard);
    }

    @Override
    public Iterator<IndexEntry<K, V>> scan(EpochGuard guard) {
        requireCapability(Capability.SCAN);
        if (guard == null) {
            throw new IllegalArgumentException("Epoch guard can't be null");
        }
        guard.checkActive();

        return new VisibleEntryIterator(this.records, guard.epoch(), guard);
    }

    @Override
    public int bulkload(List<IndexEntry<K, V>> entries, int parallelism) {
        requireCapability(Capability.BULKLOAD);
        if (entries == null) {
            throw new IllegalArgumentException("Entries can't be null");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive");
        }

        for (int i = 1; i < entries.size(); i++) {
            if (this.comparator.compare(entries.get(i - 1).key(), entries.get(i).key()) >= 0) {
                throw new IllegalArgumentException("Bulkload entries must be sorted by key without duplicates");
            }
        }

        if (entries.isEmpty()) {
            return SUCCESS;
        }

        int workers = Math.min(parallelism, entries.size());
        int sliceSize = (entries.size() + workers - 1) / workers;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<Integer>> results = new ArrayList<>(workers);
            for (int from = 0; from < entries.size(); from += sliceSize) {
                List<IndexEntry<K, V>> slice = entries.subList(from, Math.min(from + sliceSize, entries.size()));
                results.add(pool.submit(() -> loadSlice(slice)));
            }

            int rc = SUCCESS;
            for (Future<Integer> result : results) {
                int sliceRc = result.get();
                if (rc == SUCCESS) {
                    rc = sliceRc;
                }
            }

            logger.debug("Bulkloaded {} entries with {} workers", entries.size(), workers);
            return rc;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Thread interrupted during bulkload", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Bulkload worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private int loadSlice(List<IndexEntry<K, V>> slice) {
        int rc = SUCCESS;
        for (IndexEntry<K, V> entry : slice) {
            int entryRc = mutate(entry.key(), head -> true, SUCCESS, entry.payload(), entry.keyLength(),
                    entry.payloadLength());
            if (rc == SUCCESS) {
                rc = entryRc;
            }
        }
        return rc;
    }

    /**
     * @return the number of keys whose latest version is not a tombstone
     */
    public int size() {
        int count = 0;
        for (Version<V> head : this.records.values()) {
            if (isLive(head)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param key
     * @return the length of the key's version chain, tombstones included
     */
    int versionCount(K key) {
        int count = 0;
        for (Version<V> v = this.records.get(key); v != null; v = v.older) {
            count++;
        }
        return count;
    }

    @Override
    public void close() {
        if (this.epochTicker != null) {
            this.epochTicker.shutdownNow();
            try {
                if (!this.epochTicker.awaitTermination(1, TimeUnit.SECONDS)) {
                    logger.warn("Epoch ticker did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        this.records.clear();
    }

    /**
     * Atomically push a new version for the key if the precondition holds on the
     * current head. The chain is pruned either way. {@code compute} may apply the function more than once, so the
     * result code is overwritten by each application.
     *
     * @param key
     * @param precondition  tested against the current head, possibly null
     * @param failureCode   returned when the precondition fails
     * @param payload       the new payload, or null for a tombstone
     * @param keyLength
     * @param payloadLength
     * @return {@link #SUCCESS} or {@code failureCode}
     */
    private int mutate(K key, Predicate<Version<V>> precondition, int failureCode, V payload, int keyLength,
            int payloadLength) {
        checkKey(key);

        int[] rc = new int[1];
        this.records.compute(key, (k, head) -> {
            long minProtected = this.epochManager.minProtectedEpoch();
            if (!precondition.test(head)) {
                rc[0] = failureCode;
                return head == null ? null : prune(head, minProtected);
            }

            rc[0] = SUCCESS;
            Version<V> added = new Version<>(this.epochManager.currentEpoch(), payload, keyLength, payloadLength,
                    head);
            return prune(added, minProtected);
        });
        return rc[0];
    }

    /**
     * Drop every version that no reader can reach: anything older than the
     * newest version stamped before {@code minProtected}. A chain reduced to an
     * unreachable-history tombstone disappears entirely.
     *
     * @param head
     * @param minProtected
     * @return the truncated chain, or null to remove the key
     */
    private static <V> Version<V> prune(Version<V> head, long minProtected) {
        if (head.epoch < minProtected && head.isTombstone()) {
            return null;
        }
        return truncate(head, minProtected);
    }

    private static <V> Version<V> truncate(Version<V> version, long minProtected) {
        if (version == null) {
            return null;
        }
        if (version.epoch < minProtected) {
            return version.older == null ? version : version.withOlder(null);
        }

        Version<V> older = truncate(version.older, minProtected);
        return older == version.older ? version : version.withOlder(older);
    }

    private static <V> Version<V> visibleAt(Version<V> head, long snapshotEpoch) {
        Version<V> version = head;
        while (version != null && version.epoch >= snapshotEpoch) {
            version = version.older;
        }
        return version;
    }

    private static <V> boolean isLive(Version<V> version) {
        return version != null && !version.isTombstone();
    }

    private static long snapshotEpoch(EpochGuard guard, List<Long> protectedEpochs) {
        if (guard == null) {
            throw new IllegalArgumentException("Epoch guard can't be null");
        }
        if (protectedEpochs == null || protectedEpochs.isEmpty()) {
            throw new IllegalArgumentException("Protected epochs can't be empty");
        }
        if (protectedEpochs.get(0) != guard.epoch()) {
            throw new IllegalArgumentException("Protected epochs don't belong to " + guard);
        }
        guard.checkActive();

        return guard.epoch();
    }

    private NavigableMap<K, Version<V>> range(ScanKey<K> begin, ScanKey<K> end) {
        if (begin != null && end != null) {
            if (this.comparator.compare(begin.key(), end.key()) > 0) {
                return Collections.emptyNavigableMap();
            }
            return this.records.subMap(begin.key(), begin.isClosed(), end.key(), end.isClosed());
        } else if (begin != null) {
            return this.records.tailMap(begin.key(), begin.isClosed());
        } else if (end != null) {
            return this.records.headMap(end.key(), end.isClosed());
        }
        return this.records;
    }

    private void requireCapability(Capability capability) {
        if (!this.capabilities.has(capability)) {
            throw new UnsupportedOperationException(capability + " is disabled for this index");
        }
    }

    private static void checkKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }
    }

    private static void checkPayload(Object payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload can't be null");
        }
    }

    @Override
    public String toString() {
        return new StringBuilder()
                .append("VersionedSkipListIndex: [keys: ")
                .append(this.records.size())
                .append(", ")
                .append(this.capabilities)
                .append("]")
                .toString();
    }

    /**
     * One immutable version in a key's chain. A null payload marks a tombstone.
     */
    private static final class Version<V> {
        final long epoch;
        final V payload;
        final int keyLength;
        final int payloadLength;
        final Version<V> older;

        Version(long epoch, V payload, int keyLength, int payloadLength, Version<V> older) {
            this.epoch = epoch;
            this.payload = payload;
            this.keyLength = keyLength;
            this.payloadLength = payloadLength;
            this.older = older;
        }

        boolean isTombstone() {
            return this.payload == null;
        }

        Version<V> withOlder(Version<V> replacement) {
            return new Version<>(this.epoch, this.payload, this.keyLength, this.payloadLength, replacement);
        }
    }

    /**
     * Lazily walks a key range and yields the version visible at the snapshot
     * epoch, skipping keys that are absent or deleted there.
     */
    private final class VisibleEntryIterator implements Iterator<IndexEntry<K, V>> {

        private final Iterator<Map.Entry<K, Version<V>>> source;
        private final long snapshotEpoch;
        private final EpochGuard guard;
        private IndexEntry<K, V> nextEntry;

        VisibleEntryIterator(NavigableMap<K, Version<V>> range, long snapshotEpoch, EpochGuard guard) {
            this.source = range.entrySet().iterator();
            this.snapshotEpoch = snapshotEpoch;
            this.guard = guard;
        }

        @Override
        public boolean hasNext() {
            if (this.guard != null) {
                this.guard.checkActive();
            }

            while (this.nextEntry == null && this.source.hasNext()) {
                Map.Entry<K, Version<V>> record = this.source.next();
                Version<V> visible = visibleAt(record.getValue(), this.snapshotEpoch);
                if (isLive(visible)) {
                    this.nextEntry = new IndexEntry<>(record.getKey(), visible.payload, visible.keyLength,
                            visible.payloadLength);
                }
            }
            return this.nextEntry != null;
        }

        @Override
        public IndexEntry<K, V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            IndexEntry<K, V> entry = this.nextEntry;
            this.nextEntry = null;
            return entry;
        }
    }
}
