package edu.yu.idxcheck.index;

/**
 * A key/payload pair with explicit byte lengths. Used both for bulkload input
 * and for scan output.
 *
 * @param <K> the key type
 * @param <V> the payload type
 */
public final class IndexEntry<K, V> {

    private final K key;
    private final V payload;
    private final int keyLength;
    private final int payloadLength;

    public IndexEntry(K key, V payload, int keyLength, int payloadLength) {
        if (key == null) {
            throw new IllegalArgumentException("Key can't be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload can't be null");
        }

        this.key = key;
        this.payload = payload;
        this.keyLength = keyLength;
        this.payloadLength = payloadLength;
    }

    public K key() {
        return this.key;
    }

    public V payload() {
        return this.payload;
    }

    public int keyLength() {
        return this.keyLength;
    }

    public int payloadLength() {
        return this.payloadLength;
    }

    @Override
    public String toString() {
        return new StringBuilder()
                .append("IndexEntry: [key: ")
                .append(this.key)
                .append(", payload: ")
                .append(this.payload)
                .append("]")
                .toString();
    }
}
