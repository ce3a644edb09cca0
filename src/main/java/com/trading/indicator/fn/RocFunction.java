package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Rate of change in percent against the value {@code period} bars ago. */
public final class RocFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar roc;

    private RocFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "ROC(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.roc = doubleVar("roc");
    }

    public static RocFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(RocFunction.class, baseVar, period),
                () -> new RocFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value()) {
            roc.setDouble(i, Null.DOUBLE);
        } else {
            double then = baseVar.getDouble(i - period.intValue());
            roc.setDouble(i, then == 0 ? 0.0 : (baseVar.getDouble(i) - then) / then * 100.0);
        }
    }

    public double roc(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return roc.getDouble(idx);
    }
}
