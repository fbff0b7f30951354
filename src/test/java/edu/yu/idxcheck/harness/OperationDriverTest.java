package edu.yu.idxcheck.harness;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.yu.idxcheck.data.DataTypes;
import edu.yu.idxcheck.epoch.EpochManager;
import edu.yu.idxcheck.epoch.ProtectedEpochs;
import edu.yu.idxcheck.index.Capabilities;
import edu.yu.idxcheck.index.Capability;
import edu.yu.idxcheck.index.IndexEntry;
import edu.yu.idxcheck.index.IndexUnderTest;
import edu.yu.idxcheck.index.VersionedSkipListIndex;

public class OperationDriverTest {

    private final EpochManager epochManager = new EpochManager();
    private final List<Long> keys = DataTypes.LONG.prepare(32);
    private final List<Long> payloads = DataTypes.LONG.prepare(8);
    private VersionedSkipListIndex<Long, Long> index;

    @AfterEach
    public void teardown() {
        if (this.index != null) {
            this.index.close();
        }
    }

    private OperationDriver<Long, Long> driver(Capabilities capabilities) {
        this.index = new VersionedSkipListIndex<>(Comparator.naturalOrder(), this.epochManager, 0, capabilities);
        return new OperationDriver<>(this.index, new CapabilityGate(capabilities), DataTypes.LONG, DataTypes.LONG,
                this.keys, this.payloads);
    }

    private static List<Long> keysOf(Iterator<IndexEntry<Long, Long>> iter) {
        List<Long> result = new ArrayList<>();
        iter.forEachRemaining(entry -> result.add(entry.key()));
        return result;
    }

    @Test
    @DisplayName("Key and payload ids map to prepared values")
    public void idsMapToKeysAndPayloads() {
        OperationDriver<Long, Long> driver = driver(Capabilities.all());
        assertEquals(IndexUnderTest.SUCCESS, driver.write(10, 3));
        assertEquals(Optional.of(3L), driver.read(10));
        assertEquals(IndexUnderTest.KEY_EXISTS, driver.insert(10, 4));
        assertEquals(IndexUnderTest.SUCCESS, driver.update(10, 5));
        assertEquals(Optional.of(5L), driver.read(10));
        assertEquals(IndexUnderTest.SUCCESS, driver.delete(10));
        assertEquals(Optional.empty(), driver.read(10));
    }

    @Test
    @DisplayName("scan() by ids covers [begin, end)")
    public void scansAreClosedOpen() {
        OperationDriver<Long, Long> driver = driver(Capabilities.all());
        for (int id = 0; id < 20; id++) {
            driver.write(id, id % 8);
        }
        assertEquals(List.of(4L, 5L, 6L), keysOf(driver.scan(4, 7)));

        this.epochManager.forwardGlobalEpoch();
        try (ProtectedEpochs snapshot = this.epochManager.getProtectedEpochs()) {
            driver.delete(5);
            assertEquals(List.of(4L, 5L, 6L), keysOf(driver.scan(snapshot, 4, 7)));
            assertEquals(20, keysOf(driver.scan(snapshot.guard())).size());
            assertEquals(Optional.of(5L), driver.snapshotRead(5, snapshot));
        }
        assertEquals(List.of(4L, 6L), keysOf(driver.scan(4, 7)));
    }

    @Test
    @DisplayName("Calls without the capability are neutral no-ops")
    public void missingCapabilitiesAreNeutral() {
        OperationDriver<Long, Long> driver = driver(Capabilities.of(Capability.WRITE));
        assertEquals(OperationDriver.NEUTRAL, driver.insert(1, 1));
        assertEquals(OperationDriver.NEUTRAL, driver.update(1, 1));
        assertEquals(OperationDriver.NEUTRAL, driver.delete(1));
        assertEquals(OperationDriver.NEUTRAL, driver.bulkload(driver.entries(8, 16, id -> id % 8), 2));
        assertFalse(driver.scan(0, 10).hasNext());
        try (ProtectedEpochs snapshot = this.epochManager.getProtectedEpochs()) {
            assertFalse(driver.scan(snapshot, 0, 10).hasNext());
            assertFalse(driver.scan(snapshot.guard()).hasNext());
        }
        // nothing reached the index
        assertEquals(0, this.index.size());
    }

    @Test
    @DisplayName("entries() carries key and payload lengths")
    public void entriesCarryLengths() {
        OperationDriver<Long, Long> driver = driver(Capabilities.all());
        List<IndexEntry<Long, Long>> entries = driver.entries(8, 12, id -> id % 8);
        assertEquals(4, entries.size());
        assertEquals(9L, entries.get(1).key().longValue());
        assertEquals(1L, entries.get(1).payload().longValue());
        assertEquals(Long.BYTES, entries.get(1).keyLength());

        assertEquals(IndexUnderTest.SUCCESS, driver.bulkload(entries, 2));
        assertEquals(4, this.index.size());
    }
}
