package com.trading.indicator.api;

/**
 * A named column of values aligned one-to-one with the indices of a time axis.
 *
 * <p>
 * Reads outside {@code [0, size())} fail with
 * {@link IndexOutOfBoundsException}. A slot that was never written reads as the
 * column's Null sentinel. Columns carry no synchronization of their own: the
 * owner (a function, or the base series for OHLCV) serializes writes.
 *
 * <p>
 * Columns are compared by identity; two columns with the same name are still
 * distinct inputs to a formula.
 *
 * @param <V> Boxed value type.
 */
public interface TVar<V> {

    String name();

    /** Current length of the time axis this column is attached to. */
    int size();

    V get(int index);

    void set(int index, V value);

    /** Grows internal storage to the current axis size, filling with Null. */
    void ensureCapacity();
}
