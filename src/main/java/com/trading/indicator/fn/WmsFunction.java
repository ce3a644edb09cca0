package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Williams %R, expressed 0..100 with 100 at the bottom of the range. */
public final class WmsFunction extends Function {
    private final Factor period;

    private final DoubleVar wms;

    private WmsFunction(BaseSeries baseSer, Factor period) {
        super(baseSer, "WMS(" + period + ")");
        this.period = requirePeriod(period);
        this.wms = doubleVar("wms");
    }

    public static WmsFunction of(BaseSeries baseSer, Factor period) {
        return baseSer.function(FunctionKey.of(WmsFunction.class, period), () -> new WmsFunction(baseSer, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            wms.setDouble(i, Null.DOUBLE);
            return;
        }
        double highest = max(i, H, period);
        double lowest = min(i, L, period);
        double range = highest - lowest;
        wms.setDouble(i, range == 0 ? 50.0 : 100.0 - (C.getDouble(i) - lowest) / range * 100.0);
    }

    public double wms(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return wms.getDouble(idx);
    }
}
