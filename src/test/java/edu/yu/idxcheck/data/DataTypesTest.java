package edu.yu.idxcheck.data;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class DataTypesTest {

    private static final Logger logger = LogManager.getLogger(DataTypesTest.class);

    private static <T> void assertStrictlyAscending(DataType<T> type, List<T> values) {
        for (int i = 1; i < values.size(); i++) {
            assertTrue(type.comparator().compare(values.get(i - 1), values.get(i)) < 0,
                    "Values " + (i - 1) + " and " + i + " are out of order");
        }
    }

    @Nested
    @DisplayName("Fixed length")
    class FixedLength {

        @Test
        @DisplayName("LONG values ascend with their ids")
        public void longValuesAscend() {
            List<Long> values = DataTypes.LONG.prepare(1000);
            assertEquals(1000, values.size());
            assertEquals(0L, values.get(0).longValue());
            assertEquals(999L, values.get(999).longValue());
            assertStrictlyAscending(DataTypes.LONG, values);
            assertEquals(8, DataTypes.LONG.length(values.get(5)));
            assertFalse(DataTypes.LONG.isVariableLength());
        }

        @Test
        @DisplayName("INT values ascend with their ids")
        public void intValuesAscend() {
            List<Integer> values = DataTypes.INT.prepare(500);
            assertStrictlyAscending(DataTypes.INT, values);
            assertEquals(4, DataTypes.INT.length(values.get(0)));
            assertFalse(DataTypes.INT.isVariableLength());
        }

        @Test
        @DisplayName("isEqual() follows the comparator")
        public void equalityFollowsComparator() {
            assertTrue(DataTypes.LONG.isEqual(42L, Long.valueOf(42)));
            assertFalse(DataTypes.LONG.isEqual(42L, 43L));
            assertFalse(DataTypes.LONG.isEqual(null, 43L));
            assertTrue(DataTypes.LONG.isEqual(null, null));
        }
    }

    @Nested
    @DisplayName("Variable length")
    class VariableLength {

        @Test
        @DisplayName("VAR_BYTES order matches ids across digit counts")
        public void orderMatchesIdsAcrossDigitCounts() {
            List<byte[]> values = DataTypes.VAR_BYTES.prepare(12000);
            assertStrictlyAscending(DataTypes.VAR_BYTES, values);
            assertTrue(DataTypes.VAR_BYTES.isVariableLength());
        }

        @Test
        @DisplayName("VAR_BYTES lengths vary with the value")
        public void lengthsDiffer() {
            List<byte[]> values = DataTypes.VAR_BYTES.prepare(101);
            assertEquals(2, DataTypes.VAR_BYTES.length(values.get(7)));
            assertEquals(3, DataTypes.VAR_BYTES.length(values.get(42)));
            assertEquals(4, DataTypes.VAR_BYTES.length(values.get(100)));
        }

        @Test
        @DisplayName("VAR_BYTES equality is by content")
        public void equalityIsByContent() {
            byte[] a = VarBytesType.encode(77);
            byte[] b = VarBytesType.encode(77);
            assertNotSame(a, b);
            assertTrue(DataTypes.VAR_BYTES.isEqual(a, b));
            assertFalse(DataTypes.VAR_BYTES.isEqual(a, VarBytesType.encode(78)));
        }

        @Test
        @DisplayName("render() shows the digits")
        public void renderShowsDigits() {
            assertEquals("1234", DataTypes.VAR_BYTES.render(VarBytesType.encode(1234)));
        }
    }

    @Test
    @DisplayName("release() clears the prepared values")
    public void releaseClearsValues() {
        List<Long> values = new ArrayList<>(DataTypes.LONG.prepare(10));
        DataTypes.LONG.release(values);
        assertTrue(values.isEmpty());
        DataTypes.LONG.release(null);
    }

    @Test
    @DisplayName("prepare() rejects a negative count")
    public void negativeCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> DataTypes.LONG.prepare(-1));
        assertThrows(IllegalArgumentException.class, () -> DataTypes.INT.prepare(-1));
        assertThrows(IllegalArgumentException.class, () -> DataTypes.VAR_BYTES.prepare(-1));
        logger.info("Negative counts rejected by every type");
    }
}
