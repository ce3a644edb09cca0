package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/**
 * Lowest value of the last {@code period} values.
 */
public final class MinFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar min;

    private MinFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "MIN(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.min = doubleVar("min");
    }

    public static MinFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(MinFunction.class, baseVar, period),
                () -> new MinFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            min.setDouble(i, Null.DOUBLE);
        } else {
            double prev = i > 0 ? min.getDouble(i - 1) : Null.DOUBLE;
            min.setDouble(i, StatsFunctions.imin(i, baseVar, period.intValue(), prev));
        }
    }

    public double min(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return min.getDouble(idx);
    }
}
