package edu.yu.idxcheck.index;

import java.util.Objects;

/**
 * One end of a range scan: a key, its byte length, and whether the key itself
 * belongs to the range.
 *
 * @param <K> the key type
 */
public final class ScanKey<K> {

    private final K key;
    private final int length;
    private final boolean closed;

    public ScanKey(K key, int length, boolean closed) {
        if (key == null) {
            throw new IllegalArgumentException("Scan key can't be null");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Key length must be >= 0");
        }

        this.key = key;
        this.length = length;
        this.closed = closed;
    }

    public static <K> ScanKey<K> closed(K key, int length) {
        return new ScanKey<>(key, length, true);
    }

    public static <K> ScanKey<K> open(K key, int length) {
        return new ScanKey<>(key, length, false);
    }

    public K key() {
        return this.key;
    }

    public int length() {
        return this.length;
    }

    public boolean isClosed() {
        return this.closed;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o instanceof ScanKey)) {
            return false;
        }
        ScanKey<?> other = (ScanKey<?>) o;
        return this.key.equals(other.key) && this.length == other.length && this.closed == other.closed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.key, this.length, this.closed);
    }

    @Override
    public String toString() {
        return (this.closed ? "[" : "(") + this.key + ", len=" + this.length + ")";
    }
}
