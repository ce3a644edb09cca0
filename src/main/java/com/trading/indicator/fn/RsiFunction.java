package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Relative strength index on closes: the sum of up moves as a percentage of all
 * moves over {@code period} bars. Needs {@code period} changes, so it is Null
 * while {@code i < period}.
 */
public final class RsiFunction extends Function {
    private final Factor period;

    private final DoubleVar up;
    private final DoubleVar dn;
    private final DoubleVar rsi;

    private RsiFunction(BaseSeries baseSer, Factor period) {
        super(baseSer, "RSI(" + period + ")");
        this.period = requirePeriod(period);
        this.up = doubleVar("up");
        this.dn = doubleVar("dn");
        this.rsi = doubleVar("rsi");
    }

    public static RsiFunction of(BaseSeries baseSer, Factor period) {
        return baseSer.function(FunctionKey.of(RsiFunction.class, period), () -> new RsiFunction(baseSer, period));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            up.setDouble(i, Null.DOUBLE);
            dn.setDouble(i, Null.DOUBLE);
            rsi.setDouble(i, Null.DOUBLE);
            return;
        }

        double change = C.getDouble(i) - C.getDouble(i - 1);
        up.setDouble(i, change > 0 ? change : 0.0);
        dn.setDouble(i, change > 0 ? 0.0 : -change);

        if (i < period.value()) {
            rsi.setDouble(i, Null.DOUBLE);
        } else {
            double upSum = sum(i, up, period);
            double dnSum = sum(i, dn, period);
            rsi.setDouble(i, upSum + dnSum == 0 ? 0.0 : upSum / (upSum + dnSum) * 100.0);
        }
    }

    public double rsi(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return rsi.getDouble(idx);
    }
}
