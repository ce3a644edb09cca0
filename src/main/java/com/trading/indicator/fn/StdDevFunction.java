package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/** Population standard deviation of the last {@code period} values. */
public final class StdDevFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar stdDev;

    private StdDevFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "STDDEV(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.stdDev = doubleVar("stdDev");
    }

    public static StdDevFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(StdDevFunction.class, baseVar, period),
                () -> new StdDevFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            stdDev.setDouble(i, Null.DOUBLE);
        } else {
            stdDev.setDouble(i, StatsFunctions.stdDev(baseVar, i - period.intValue() + 1, i));
        }
    }

    public double stdDev(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return stdDev.getDouble(idx);
    }
}
