package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/**
 * Highest value of the last {@code period} values.
 */
public final class MaxFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar max;

    private MaxFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "MAX(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.max = doubleVar("max");
    }

    public static MaxFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(MaxFunction.class, baseVar, period),
                () -> new MaxFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            max.setDouble(i, Null.DOUBLE);
        } else {
            double prev = i > 0 ? max.getDouble(i - 1) : Null.DOUBLE;
            max.setDouble(i, StatsFunctions.imax(i, baseVar, period.intValue(), prev));
        }
    }

    public double max(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return max.getDouble(idx);
    }
}
