package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Average directional movement rating: mean of today's ADX and the ADX
 * {@code periodAdx} bars ago.
 */
public final class AdxrFunction extends Function {
    private final Factor periodDi;
    private final Factor periodAdx;

    private final DoubleVar adx;
    private final DoubleVar adxr;

    private AdxrFunction(BaseSeries baseSer, Factor periodDi, Factor periodAdx) {
        super(baseSer, "ADXR(" + periodDi + ", " + periodAdx + ")");
        this.periodDi = requirePeriod(periodDi);
        this.periodAdx = requirePeriod(periodAdx);
        this.adx = doubleVar("adx");
        this.adxr = doubleVar("adxr");
    }

    public static AdxrFunction of(BaseSeries baseSer, Factor periodDi, Factor periodAdx) {
        return baseSer.function(FunctionKey.of(AdxrFunction.class, periodDi, periodAdx),
                () -> new AdxrFunction(baseSer, periodDi, periodAdx));
    }

    @Override
    protected void computeSpot(int i) {
        adx.setDouble(i, adx(i, periodDi, periodAdx));

        // the lagged ADX must exist too
        if (i < periodDi.value() + 2 * periodAdx.value() - 1) {
            adxr.setDouble(i, Null.DOUBLE);
        } else {
            double adxNow = adx.getDouble(i);
            double adxThen = adx.getDouble(i - periodAdx.intValue());
            adxr.setDouble(i, (adxNow + adxThen) / 2.0);
        }
    }

    public double adxr(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return adxr.getDouble(idx);
    }
}
