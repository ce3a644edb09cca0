package com.trading.indicator.series;

import com.trading.indicator.api.TVar;

/** Shared bounds checking for columns attached to a {@link TimeAxis}. */
abstract class AbstractVar<V> implements TVar<V> {
    protected final String name;
    protected final TimeAxis axis;

    protected AbstractVar(String name, TimeAxis axis) {
        this.name = name;
        this.axis = axis;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final int size() {
        return axis.size();
    }

    @Override
    public final void ensureCapacity() {
        grow(axis.size());
    }

    protected final void checkIndex(int index) {
        int n = axis.size();
        if (index < 0 || index >= n)
            throw new IndexOutOfBoundsException(
                    "Index " + index + " out of bounds for column '" + name + "' of size " + n);
    }

    /** Grows storage to at least {@code capacity} slots, filling with Null. */
    protected abstract void grow(int capacity);

    @Override
    public String toString() {
        return name;
    }
}
