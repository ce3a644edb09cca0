package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Commodity channel index over the typical price {@code (H + 2C + L) / 4}.
 * {@code alpha} is the scaling constant, conventionally 0.015.
 */
public final class CciFunction extends Function {
    private final Factor period;
    private final Factor alpha;

    private final DoubleVar tp;
    private final DoubleVar deviation;
    private final DoubleVar cci;

    private CciFunction(BaseSeries baseSer, Factor period, Factor alpha) {
        super(baseSer, "CCI(" + period + ", " + alpha + ")");
        this.period = requirePeriod(period);
        this.alpha = alpha;
        this.tp = doubleVar("tp");
        this.deviation = doubleVar("deviation");
        this.cci = doubleVar("cci");
    }

    public static CciFunction of(BaseSeries baseSer, Factor period, Factor alpha) {
        return baseSer.function(FunctionKey.of(CciFunction.class, period, alpha),
                () -> new CciFunction(baseSer, period, alpha));
    }

    @Override
    protected void computeSpot(int i) {
        tp.setDouble(i, (H.getDouble(i) + 2 * C.getDouble(i) + L.getDouble(i)) / 4.0);

        if (i < period.value() - 1) {
            deviation.setDouble(i, Null.DOUBLE);
            cci.setDouble(i, Null.DOUBLE);
        } else {
            double tpMa = ma(i, tp, period);
            deviation.setDouble(i, Math.abs(tp.getDouble(i) - tpMa));
            double deviationMa = ma(i, deviation, period);
            cci.setDouble(i, (tp.getDouble(i) - tpMa) / (alpha.value() * deviationMa));
        }
    }

    public double cci(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return cci.getDouble(idx);
    }
}
