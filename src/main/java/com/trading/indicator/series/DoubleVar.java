package com.trading.indicator.series;

import com.trading.indicator.api.Null;

import java.util.Arrays;

/**
 * A column of primitive doubles, {@code NaN} meaning Null.
 *
 * <p>
 * Formulas should use {@link #getDouble(int)} and {@link #setDouble(int, double)}
 * on the hot path; the boxed {@link #get(int)} / {@link #set(int, Double)} exist
 * for generic callers.
 */
public final class DoubleVar extends AbstractVar<Double> {
    private double[] values;

    public DoubleVar(String name, TimeAxis axis) {
        super(name, axis);
        this.values = new double[0];
    }

    public double getDouble(int index) {
        checkIndex(index);
        double[] v = values;
        return index < v.length ? v[index] : Null.DOUBLE;
    }

    public void setDouble(int index, double value) {
        checkIndex(index);
        if (index >= values.length) {
            grow(index + 1);
        }
        values[index] = value;
    }

    @Override
    public Double get(int index) {
        return getDouble(index);
    }

    @Override
    public void set(int index, Double value) {
        setDouble(index, value == null ? Null.DOUBLE : value);
    }

    /** Copies {@code [from, to]} into a new array, Null-filling unwritten slots. */
    public double[] toArray(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        double[] out = new double[to - from + 1];
        for (int i = from; i <= to; i++) {
            out[i - from] = i < values.length ? values[i] : Null.DOUBLE;
        }
        return out;
    }

    @Override
    protected void grow(int capacity) {
        int old = values.length;
        if (capacity <= old)
            return;
        int newLength = Math.max(capacity, old + (old >> 1));
        double[] grown = Arrays.copyOf(values, newLength);
        Arrays.fill(grown, old, newLength, Null.DOUBLE);
        values = grown;
    }
}
