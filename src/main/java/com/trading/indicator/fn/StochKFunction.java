package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Stochastic %K: position of the close within the {@code period} high-low
 * range, smoothed by a {@code periodK} moving average. A flat range counts as
 * the midpoint.
 */
public final class StochKFunction extends Function {
    private final Factor period;
    private final Factor periodK;

    private final DoubleVar elementK;
    private final DoubleVar stochK;

    private StochKFunction(BaseSeries baseSer, Factor period, Factor periodK) {
        super(baseSer, "STOCHK(" + period + ", " + periodK + ")");
        this.period = requirePeriod(period);
        this.periodK = requirePeriod(periodK);
        this.elementK = doubleVar("elementK");
        this.stochK = doubleVar("stochK");
    }

    public static StochKFunction of(BaseSeries baseSer, Factor period, Factor periodK) {
        return baseSer.function(FunctionKey.of(StochKFunction.class, period, periodK),
                () -> new StochKFunction(baseSer, period, periodK));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            elementK.setDouble(i, Null.DOUBLE);
            stochK.setDouble(i, Null.DOUBLE);
            return;
        }

        double highest = max(i, H, period);
        double lowest = min(i, L, period);
        double range = highest - lowest;
        elementK.setDouble(i, range == 0 ? 50.0 : (C.getDouble(i) - lowest) / range * 100.0);

        stochK.setDouble(i, ma(i, elementK, periodK));
    }

    public double stochK(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return stochK.getDouble(idx);
    }
}
