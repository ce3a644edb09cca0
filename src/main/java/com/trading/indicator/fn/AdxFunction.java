package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Average directional index: moving average of DX. */
public final class AdxFunction extends Function {
    private final Factor periodDi;
    private final Factor periodAdx;

    private final DoubleVar dx;
    private final DoubleVar adx;

    private AdxFunction(BaseSeries baseSer, Factor periodDi, Factor periodAdx) {
        super(baseSer, "ADX(" + periodDi + ", " + periodAdx + ")");
        this.periodDi = requirePeriod(periodDi);
        this.periodAdx = requirePeriod(periodAdx);
        this.dx = doubleVar("dx");
        this.adx = doubleVar("adx");
    }

    public static AdxFunction of(BaseSeries baseSer, Factor periodDi, Factor periodAdx) {
        return baseSer.function(FunctionKey.of(AdxFunction.class, periodDi, periodAdx),
                () -> new AdxFunction(baseSer, periodDi, periodAdx));
    }

    @Override
    protected void computeSpot(int i) {
        dx.setDouble(i, dx(i, periodDi));

        // dx is Null while i < periodDi, and the first full window of dx ends periodAdx - 1 later
        if (i < periodDi.value() + periodAdx.value() - 1) {
            adx.setDouble(i, Null.DOUBLE);
        } else {
            adx.setDouble(i, ma(i, dx, periodAdx));
        }
    }

    public double adx(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return adx.getDouble(idx);
    }
}
