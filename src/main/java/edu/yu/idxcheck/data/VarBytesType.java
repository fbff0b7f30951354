package edu.yu.idxcheck.data;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Variable-length byte string keys/payloads.
 * <p>
 * Encoding of value i: [digit count of i as one byte | ASCII digits of i].
 * Shorter numbers carry a smaller first byte, so unsigned lexicographic order
 * matches numeric order while the lengths still differ.
 */
final class VarBytesType implements DataType<byte[]> {

    private static final Comparator<byte[]> UNSIGNED_LEXICOGRAPHIC = Arrays::compareUnsigned;

    @Override
    public List<byte[]> prepare(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Value count must be >= 0");
        }

        List<byte[]> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add(encode(i));
        }
        return values;
    }

    static byte[] encode(int value) {
        byte[] digits = Integer.toString(value).getBytes(StandardCharsets.US_ASCII);
        byte[] encoded = new byte[digits.length + 1];
        encoded[0] = (byte) digits.length;
        System.arraycopy(digits, 0, encoded, 1, digits.length);
        return encoded;
    }

    @Override
    public int length(byte[] value) {
        return value.length;
    }

    @Override
    public Comparator<byte[]> comparator() {
        return UNSIGNED_LEXICOGRAPHIC;
    }

    @Override
    public boolean isVariableLength() {
        return true;
    }

    @Override
    public String render(byte[] value) {
        if (value == null || value.length == 0) {
            return String.valueOf(value);
        }
        return new String(value, 1, value.length - 1, StandardCharsets.US_ASCII);
    }

    @Override
    public String toString() {
        return "VAR_BYTES";
    }
}
