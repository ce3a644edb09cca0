package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;
import com.trading.indicator.util.ProbMass;
import com.trading.indicator.util.StatsFunctions;

/**
 * Rolling distribution of a column over the last {@code period} values,
 * optionally weighted by a second column (volume for a volume profile).
 *
 * <p>
 * Null while {@code i < period - 1}. Each spot scans its whole window; there is
 * no incremental form.
 */
public final class ProbMassFunction extends Function {
    private final DoubleVar baseVar;
    private final DoubleVar weight;
    private final Factor period;
    private final Factor nIntervals;

    private final ObjectVar<ProbMass> probMass;

    private ProbMassFunction(BaseSeries baseSer, DoubleVar baseVar, DoubleVar weight, Factor period,
            Factor nIntervals) {
        super(baseSer, "PROBMASS(" + baseVar.name() + (weight == null ? "" : ", " + weight.name())
                + ", " + period + ", " + nIntervals + ")");
        if (nIntervals == null || nIntervals.value() < 1)
            throw new IllegalArgumentException("Number of intervals must be >= 1: " + nIntervals);
        this.baseVar = baseVar;
        this.weight = weight;
        this.period = requirePeriod(period);
        this.nIntervals = nIntervals;
        this.probMass = objectVar("probMass");
    }

    public static ProbMassFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period, Factor nIntervals) {
        return of(baseSer, baseVar, null, period, nIntervals);
    }

    /** @param weight Weight of each value, or {@code null} to count every value once. */
    public static ProbMassFunction of(BaseSeries baseSer, DoubleVar baseVar, DoubleVar weight, Factor period,
            Factor nIntervals) {
        return baseSer.function(FunctionKey.of(ProbMassFunction.class, baseVar, weight, period, nIntervals),
                () -> new ProbMassFunction(baseSer, baseVar, weight, period, nIntervals));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            probMass.set(i, null);
        } else {
            probMass.set(i, StatsFunctions.probMass(baseVar, weight, i - period.intValue() + 1, i,
                    nIntervals.intValue()));
        }
    }

    public ProbMass probMass(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return probMass.get(idx);
    }
}
