package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Directional movement index: spread of +DI and -DI relative to their sum. */
public final class DxFunction extends Function {
    private final Factor period;

    private final DoubleVar diPlus;
    private final DoubleVar diMinus;
    private final DoubleVar dx;

    private DxFunction(BaseSeries baseSer, Factor period) {
        super(baseSer, "DX(" + period + ")");
        this.period = requirePeriod(period);
        this.diPlus = doubleVar("diPlus");
        this.diMinus = doubleVar("diMinus");
        this.dx = doubleVar("dx");
    }

    public static DxFunction of(BaseSeries baseSer, Factor period) {
        return baseSer.function(FunctionKey.of(DxFunction.class, period), () -> new DxFunction(baseSer, period));
    }

    @Override
    protected void computeSpot(int i) {
        diPlus.setDouble(i, diPlus(i, period));
        diMinus.setDouble(i, diMinus(i, period));

        if (i < period.value()) {
            dx.setDouble(i, Null.DOUBLE);
        } else {
            double plus = diPlus.getDouble(i);
            double minus = diMinus.getDouble(i);
            dx.setDouble(i, plus + minus == 0 ? 0.0 : Math.abs(plus - minus) / (plus + minus) * 100.0);
        }
    }

    public double dx(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return dx.getDouble(idx);
    }
}
