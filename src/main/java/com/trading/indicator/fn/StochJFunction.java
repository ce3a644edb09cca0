package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** The J line of KDJ: {@code 3K - 2D}. */
public final class StochJFunction extends Function {
    private final Factor period;
    private final Factor periodK;
    private final Factor periodD;

    private final DoubleVar stochK;
    private final DoubleVar stochD;
    private final DoubleVar stochJ;

    private StochJFunction(BaseSeries baseSer, Factor period, Factor periodK, Factor periodD) {
        super(baseSer, "STOCHJ(" + period + ", " + periodK + ", " + periodD + ")");
        this.period = requirePeriod(period);
        this.periodK = requirePeriod(periodK);
        this.periodD = requirePeriod(periodD);
        this.stochK = doubleVar("stochK");
        this.stochD = doubleVar("stochD");
        this.stochJ = doubleVar("stochJ");
    }

    public static StochJFunction of(BaseSeries baseSer, Factor period, Factor periodK, Factor periodD) {
        return baseSer.function(FunctionKey.of(StochJFunction.class, period, periodK, periodD),
                () -> new StochJFunction(baseSer, period, periodK, periodD));
    }

    @Override
    protected void computeSpot(int i) {
        stochK.setDouble(i, stochK(i, period, periodK));
        stochD.setDouble(i, stochD(i, period, periodK, periodD));
        stochJ.setDouble(i, 3 * stochK.getDouble(i) - 2 * stochD.getDouble(i));
    }

    public double stochJ(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return stochJ.getDouble(idx);
    }
}
