package com.trading.indicator.series;

import java.util.Arrays;

/** A column of references, {@code null} meaning Null. */
public final class ObjectVar<V> extends AbstractVar<V> {
    private Object[] values = new Object[0];

    public ObjectVar(String name, TimeAxis axis) {
        super(name, axis);
    }

    @Override
    @SuppressWarnings("unchecked")
    public V get(int index) {
        checkIndex(index);
        Object[] v = values;
        return index < v.length ? (V) v[index] : null;
    }

    @Override
    public void set(int index, V value) {
        checkIndex(index);
        if (index >= values.length) {
            grow(index + 1);
        }
        values[index] = value;
    }

    @Override
    protected void grow(int capacity) {
        int old = values.length;
        if (capacity <= old)
            return;
        values = Arrays.copyOf(values, Math.max(capacity, old + (old >> 1)));
    }
}
