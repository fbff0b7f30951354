package edu.yu.idxcheck.data;

import java.util.Comparator;
import java.util.List;

/**
 * A key or payload type the harness can generate test data for. Values
 * returned by {@link #prepare(int)} are distinct and strictly ascending under
 * {@link #comparator()}, so the i-th value always sorts before the (i+1)-th.
 *
 * @param <T> the value type
 */
public interface DataType<T> {

    /**
     * Generate {@code n} distinct values in ascending order.
     *
     * @param n the number of values
     * @return a mutable list of {@code n} values
     */
    List<T> prepare(int n);

    /**
     * Give back values created by {@link #prepare(int)}. The list is unusable
     * afterwards.
     *
     * @param values
     */
    default void release(List<T> values) {
        if (values != null) {
            values.clear();
        }
    }

    /**
     * @param value
     * @return the byte length of the value
     */
    int length(T value);

    /**
     * @return a strict ordering over values of this type
     */
    Comparator<T> comparator();

    /**
     * @return true if values of this type have differing lengths
     */
    boolean isVariableLength();

    /**
     * Equality derived from the ordering: neither value sorts before the other.
     *
     * @param a
     * @param b
     * @return true if the values are equal under {@link #comparator()}
     */
    default boolean isEqual(T a, T b) {
        if (a == null || b == null) {
            return a == b;
        }
        return comparator().compare(a, b) == 0;
    }

    /**
     * @param value
     * @return a human readable rendering for violation messages
     */
    default String render(T value) {
        return String.valueOf(value);
    }
}
