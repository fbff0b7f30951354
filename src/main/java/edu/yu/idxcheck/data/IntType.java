package edu.yu.idxcheck.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-length 4 byte keys/payloads. The i-th prepared value is {@code i}.
 */
final class IntType implements DataType<Integer> {

    @Override
    public List<Integer> prepare(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Value count must be >= 0");
        }

        List<Integer> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add(i);
        }
        return values;
    }

    @Override
    public int length(Integer value) {
        return Integer.BYTES;
    }

    @Override
    public Comparator<Integer> comparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isVariableLength() {
        return false;
    }

    @Override
    public String toString() {
        return "INT";
    }
}
