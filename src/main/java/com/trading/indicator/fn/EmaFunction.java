package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.util.StatsFunctions;

/**
 * Exponential moving average with smoothing weight {@code 1 / period}.
 *
 * <p>
 * Has no warm-up: the first value is the input itself.
 */
public final class EmaFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;

    private final DoubleVar ema;

    private EmaFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        super(baseSer, "EMA(" + baseVar.name() + ", " + period + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.ema = doubleVar("ema");
    }

    public static EmaFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period) {
        return baseSer.function(FunctionKey.of(EmaFunction.class, baseVar, period),
                () -> new EmaFunction(baseSer, baseVar, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            ema.setDouble(i, baseVar.getDouble(i));
        } else {
            ema.setDouble(i, StatsFunctions.iema(i, baseVar, period.intValue(), ema.getDouble(i - 1)));
        }
    }

    public double ema(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return ema.getDouble(idx);
    }
}
