package edu.yu.idxcheck.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-length 8 byte keys/payloads. The i-th prepared value is {@code i}.
 */
final class LongType implements DataType<Long> {

    @Override
    public List<Long> prepare(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Value count must be >= 0");
        }

        List<Long> values = new ArrayList<>(n);
        for (long i = 0; i < n; i++) {
            values.add(i);
        }
        return values;
    }

    @Override
    public int length(Long value) {
        return Long.BYTES;
    }

    @Override
    public Comparator<Long> comparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isVariableLength() {
        return false;
    }

    @Override
    public String toString() {
        return "LONG";
    }
}
