package com.trading.indicator.util;

import com.trading.indicator.api.Null;
import com.trading.indicator.series.DoubleVar;

/**
 * Window statistics over a column, in plain and incremental ("i") forms.
 *
 * <p>
 * The incremental forms take the previous result and update it in O(1) when
 * possible. They fall back to a full window scan when the previous result is
 * Null (a Null inside the earlier window) or, for max/min, when the value
 * leaving the window was the extreme. All return Null when fewer than
 * {@code period} values are available.
 *
 * <p>
 * Null inputs: {@code max}/{@code min} skip them. {@code sum}, {@code ma},
 * {@code stdDev} and their incremental forms propagate them, so a Null inside
 * the window yields Null. {@code iema} carries the previous value across a
 * Null input.
 */
public final class StatsFunctions {

    private StatsFunctions() {
    }

    /** First index of the window of length {@code period} ending at {@code idx}. */
    public static int lookback(int idx, int period) {
        return idx - period + 1;
    }

    public static double sum(DoubleVar var, int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx < fromIdx)
            return Null.DOUBLE;
        double sum = 0.0;
        for (int i = fromIdx; i <= toIdx; i++) {
            sum += var.getDouble(i);
        }
        return sum;
    }

    public static double isum(int idx, DoubleVar var, int period, double prev) {
        int lookbackIdx = lookback(idx, period);
        if (lookbackIdx < 0) {
            return Null.DOUBLE;
        } else if (lookbackIdx == 0 || Null.is(prev)) {
            return sum(var, lookbackIdx, idx);
        } else {
            return prev + var.getDouble(idx) - var.getDouble(lookbackIdx - 1);
        }
    }

    public static double ma(DoubleVar var, int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx < fromIdx)
            return Null.DOUBLE;
        return sum(var, fromIdx, toIdx) / (toIdx - fromIdx + 1);
    }

    public static double ima(int idx, DoubleVar var, int period, double prev) {
        int lookbackIdx = lookback(idx, period);
        if (lookbackIdx < 0) {
            return Null.DOUBLE;
        } else if (lookbackIdx == 0 || Null.is(prev)) {
            return ma(var, lookbackIdx, idx);
        } else {
            return prev + (var.getDouble(idx) - var.getDouble(lookbackIdx - 1)) / period;
        }
    }

    /**
     * Exponential smoothing with weight {@code 1 / period}. Seeds at the first
     * non-Null input and carries the previous value across Null inputs.
     */
    public static double iema(int idx, DoubleVar var, int period, double prev) {
        double value = var.getDouble(idx);
        if (Null.is(prev)) {
            return value;
        }
        if (Null.is(value)) {
            return prev;
        }
        double a = 1.0 / period;
        return (1.0 - a) * prev + a * value;
    }

    /** Max of the non-Null values in {@code [fromIdx, toIdx]}, Null if none. */
    public static double max(DoubleVar var, int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx < fromIdx)
            return Null.DOUBLE;
        double max = Null.DOUBLE;
        for (int i = fromIdx; i <= toIdx; i++) {
            double v = var.getDouble(i);
            if (!Null.is(v) && (Null.is(max) || v > max)) {
                max = v;
            }
        }
        return max;
    }

    public static double imax(int idx, DoubleVar var, int period, double prev) {
        int lookbackIdx = lookback(idx, period);
        if (lookbackIdx < 0) {
            return Null.DOUBLE;
        } else if (lookbackIdx == 0 || Null.is(prev) || var.getDouble(lookbackIdx - 1) == prev) {
            return max(var, lookbackIdx, idx);
        } else {
            double value = var.getDouble(idx);
            return Null.is(value) || prev >= value ? prev : value;
        }
    }

    /** Min of the non-Null values in {@code [fromIdx, toIdx]}, Null if none. */
    public static double min(DoubleVar var, int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx < fromIdx)
            return Null.DOUBLE;
        double min = Null.DOUBLE;
        for (int i = fromIdx; i <= toIdx; i++) {
            double v = var.getDouble(i);
            if (!Null.is(v) && (Null.is(min) || v < min)) {
                min = v;
            }
        }
        return min;
    }

    public static double imin(int idx, DoubleVar var, int period, double prev) {
        int lookbackIdx = lookback(idx, period);
        if (lookbackIdx < 0) {
            return Null.DOUBLE;
        } else if (lookbackIdx == 0 || Null.is(prev) || var.getDouble(lookbackIdx - 1) == prev) {
            return min(var, lookbackIdx, idx);
        } else {
            double value = var.getDouble(idx);
            return Null.is(value) || prev <= value ? prev : value;
        }
    }

    /** Population standard deviation of {@code [fromIdx, toIdx]}. */
    public static double stdDev(DoubleVar var, int fromIdx, int toIdx) {
        if (fromIdx < 0 || toIdx < fromIdx)
            return Null.DOUBLE;
        double mean = ma(var, fromIdx, toIdx);
        double sumSq = 0.0;
        for (int i = fromIdx; i <= toIdx; i++) {
            double d = var.getDouble(i) - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (toIdx - fromIdx + 1));
    }

    /**
     * Distribution of the values in {@code [fromIdx, toIdx]} over
     * {@code nIntervals} equal-width bins spanning the window's min and max,
     * each value counted with its weight (1 when {@code weights} is null).
     * Null values and Null weights are left out.
     *
     * @return The distribution, or {@code null} if the window holds no value.
     */
    public static ProbMass probMass(DoubleVar var, DoubleVar weights, int fromIdx, int toIdx, int nIntervals) {
        if (nIntervals <= 0)
            throw new IllegalArgumentException("Number of intervals must be > 0: " + nIntervals);
        int begIdx = Math.max(fromIdx, 0);
        double max = max(var, begIdx, toIdx);
        double min = min(var, begIdx, toIdx);
        if (Null.is(max)) {
            return null;
        }

        double interval = nIntervals == 1 ? 0.0 : (max - min) / (nIntervals - 1);
        double[] values = new double[nIntervals];
        double[] masses = new double[nIntervals];
        for (int k = 0; k < nIntervals; k++) {
            values[k] = min + k * interval;
        }

        double total = 0.0;
        for (int i = begIdx; i <= toIdx; i++) {
            double value = var.getDouble(i);
            double weight = weights == null ? 1.0 : weights.getDouble(i);
            if (Null.is(value) || Null.is(weight)) {
                continue;
            }
            // a flat window puts everything in the first bin
            int k = interval == 0.0 ? 0 : (int) ((value - min) / interval);
            masses[Math.min(k, nIntervals - 1)] += weight;
            total += weight;
        }
        if (total != 0.0) {
            for (int k = 0; k < nIntervals; k++) {
                masses[k] /= total;
            }
        }
        return new ProbMass(values, masses);
    }
}
