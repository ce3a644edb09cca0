package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/**
 * Simple moving average over {@code period} values.
 *
 * <p>
 * Null while {@code i < period - 1}. Each new spot adjusts the previous average
 * by the entering and leaving values instead of re-summing the window.
 */
public final class MaFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar ma;

    private MaFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "MA(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.ma = doubleVar("ma");
    }

    public static MaFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(MaFunction.class, baseVar, period),
                () -> new MaFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            ma.setDouble(i, Null.DOUBLE);
        } else {
            double prev = i > 0 ? ma.getDouble(i - 1) : Null.DOUBLE;
            ma.setDouble(i, StatsFunctions.ima(i, baseVar, period.intValue(), prev));
        }
    }

    public double ma(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return ma.getDouble(idx);
    }
}
