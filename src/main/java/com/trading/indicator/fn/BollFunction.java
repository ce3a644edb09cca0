package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Bollinger bands: moving average plus and minus {@code alpha} standard
 * deviations over the same window.
 */
public final class BollFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor period;
    private final Factor alpha;

    private final DoubleVar bollMiddle;
    private final DoubleVar bollUpper;
    private final DoubleVar bollLower;

    private BollFunction(BaseSeries baseSer, DoubleVar baseVar, Factor period, Factor alpha) {
        super(baseSer, "BOLL(" + baseVar.name() + ", " + period + ", " + alpha + ")");
        this.baseVar = baseVar;
        this.period = requirePeriod(period);
        this.alpha = alpha;
        this.bollMiddle = doubleVar("middle");
        this.bollUpper = doubleVar("upper");
        this.bollLower = doubleVar("lower");
    }

    public static BollFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor period, Factor alpha) {
        return baseSer.function(FunctionKey.of(BollFunction.class, baseVar, period, alpha),
                () -> new BollFunction(baseSer, baseVar, period, alpha));
    }

    @Override
    protected void computeSpot(int i) {
        if (i < period.value() - 1) {
            bollMiddle.setDouble(i, Null.DOUBLE);
            bollUpper.setDouble(i, Null.DOUBLE);
            bollLower.setDouble(i, Null.DOUBLE);
        } else {
            double mid = ma(i, baseVar, period);
            double width = alpha.value() * stdDev(i, baseVar, period);
            bollMiddle.setDouble(i, mid);
            bollUpper.setDouble(i, mid + width);
            bollLower.setDouble(i, mid - width);
        }
    }

    public double bollMiddle(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return bollMiddle.getDouble(idx);
    }

    public double bollUpper(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return bollUpper.getDouble(idx);
    }

    public double bollLower(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return bollLower.getDouble(idx);
    }
}
