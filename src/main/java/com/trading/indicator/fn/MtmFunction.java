package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Momentum: value as a percentage of the value {@code period} bars ago. */
public final class MtmFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar mtm;

    private MtmFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "MTM(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.mtm = doubleVar("mtm");
    }

    public static MtmFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(MtmFunction.class, baseVar, period),
                () -> new MtmFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value()) {
            mtm.setDouble(i, Null.DOUBLE);
        } else {
            double then = baseVar.getDouble(i - period.intValue());
            mtm.setDouble(i, then == 0 ? Null.DOUBLE : baseVar.getDouble(i) / then * 100.0);
        }
    }

    public double mtm(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return mtm.getDouble(idx);
    }
}
