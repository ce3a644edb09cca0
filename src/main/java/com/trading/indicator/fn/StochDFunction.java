package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Stochastic %D: {@code periodD} moving average of %K. */
public final class StochDFunction extends Function {
    private final Factor period;
    private final Factor periodK;
    private final Factor periodD;

    private final DoubleVar stochK;
    private final DoubleVar stochD;

    private StochDFunction(BaseSeries baseSer, Factor period, Factor periodK, Factor periodD) {
        super(baseSer, "STOCHD(" + period + ", " + periodK + ", " + periodD + ")");
        this.period = requirePeriod(period);
        this.periodK = requirePeriod(periodK);
        this.periodD = requirePeriod(periodD);
        this.stochK = doubleVar("stochK");
        this.stochD = doubleVar("stochD");
    }

    public static StochDFunction of(BaseSeries baseSer, Factor period, Factor periodK, Factor periodD) {
        return baseSer.function(FunctionKey.of(StochDFunction.class, period, periodK, periodD),
                () -> new StochDFunction(baseSer, period, periodK, periodD));
    }

    @Override
    protected void computeSpot(int i) {
        stochK.setDouble(i, stochK(i, period, periodK));

        if (i < periodD.value() - 1) {
            stochD.setDouble(i, Null.DOUBLE);
        } else {
            stochD.setDouble(i, ma(i, stochK, periodD));
        }
    }

    public double stochD(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return stochD.getDouble(idx);
    }
}
