package edu.yu.idxcheck.index;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class CapabilitiesTest {

    @Test
    @DisplayName("all() and none() cover every and no capability")
    public void allAndNone() {
        for (Capability capability : Capability.values()) {
            assertTrue(Capabilities.all().has(capability));
            assertFalse(Capabilities.none().has(capability));
        }
        assertEquals(EnumSet.allOf(Capability.class), Capabilities.all().asSet());
    }

    @Test
    @DisplayName("missing() reports only absent capabilities")
    public void missingReportsOnlyAbsent() {
        Capabilities caps = Capabilities.allExcept(Capability.BULKLOAD, Capability.SCAN);
        assertTrue(caps.hasWrite());
        assertFalse(caps.hasScan());
        assertFalse(caps.hasBulkload());

        Set<Capability> missing = caps.missing(List.of(Capability.WRITE, Capability.SCAN, Capability.BULKLOAD));
        assertEquals(EnumSet.of(Capability.SCAN, Capability.BULKLOAD), missing);
        assertTrue(caps.missing(List.of(Capability.INSERT, Capability.DELETE)).isEmpty());
    }

    @Test
    @DisplayName("Capabilities compare by value")
    public void valueSemantics() {
        assertEquals(Capabilities.of(Capability.WRITE, Capability.DELETE),
                Capabilities.allExcept(Capability.INSERT, Capability.UPDATE, Capability.SCAN, Capability.BULKLOAD));
        assertEquals(Capabilities.of(Capability.WRITE).hashCode(), Capabilities.of(Capability.WRITE).hashCode());
        assertNotEquals(Capabilities.all(), Capabilities.none());
        assertThrows(UnsupportedOperationException.class, () -> Capabilities.all().asSet().clear());
    }
}
