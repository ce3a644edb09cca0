package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/**
 * Rolling sum over {@code period} values, updated incrementally.
 */
public final class SumFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar sum;

    private SumFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "SUM(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.sum = doubleVar("sum");
    }

    public static SumFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(SumFunction.class, baseVar, period),
                () -> new SumFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            sum.setDouble(i, Null.DOUBLE);
        } else {
            double prev = i > 0 ? sum.getDouble(i - 1) : Null.DOUBLE;
            sum.setDouble(i, StatsFunctions.isum(i, baseVar, period.intValue(), prev));
        }
    }

    public double sum(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return sum.getDouble(idx);
    }
}
