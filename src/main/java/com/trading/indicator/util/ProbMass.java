package com.trading.indicator.util;

import java.util.Arrays;

/**
 * A weighted histogram of a window of values over equal-width bins.
 *
 * <p>
 * Bin {@code k} is labelled with {@code min + k * interval}; the first bin
 * starts at the window minimum and the last one holds the maximum. Masses are
 * normalized to sum to 1 unless the window carried no weight at all.
 */
public final class ProbMass {
    private final double[] values;
    private final double[] masses;

    ProbMass(double[] values, double[] masses) {
        this.values = values;
        this.masses = masses;
    }

    public int size() {
        return values.length;
    }

    /** Label of bin {@code k}. */
    public double value(int k) {
        return values[k];
    }

    public double mass(int k) {
        return masses[k];
    }

    /** @return The bin with the largest mass, the lowest one on ties. */
    public int modeBin() {
        int mode = 0;
        for (int k = 1; k < masses.length; k++) {
            if (masses[k] > masses[mode]) {
                mode = k;
            }
        }
        return mode;
    }

    @Override
    public String toString() {
        return "ProbMass[values=" + Arrays.toString(values) + ", masses=" + Arrays.toString(masses) + "]";
    }
}
