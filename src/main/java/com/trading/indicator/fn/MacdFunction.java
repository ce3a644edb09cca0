package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Fast EMA minus slow EMA. */
public final class MacdFunction extends Function {
    private final DoubleVar baseVar;
    private final Factor periodSlow;
    private final Factor periodFast;

    private final DoubleVar emaFast;
    private final DoubleVar emaSlow;
    private final DoubleVar macd;

    private MacdFunction(BaseSeries baseSer, DoubleVar baseVar, Factor periodSlow, Factor periodFast) {
        super(baseSer, "MACD(" + baseVar.name() + ", " + periodSlow + ", " + periodFast + ")");
        this.baseVar = baseVar;
        this.periodSlow = requirePeriod(periodSlow);
        this.periodFast = requirePeriod(periodFast);
        this.emaFast = doubleVar("emaFast");
        this.emaSlow = doubleVar("emaSlow");
        this.macd = doubleVar("macd");
    }

    public static MacdFunction of(BaseSeries baseSer, DoubleVar baseVar, Factor periodSlow, Factor periodFast) {
        return baseSer.function(FunctionKey.of(MacdFunction.class, baseVar, periodSlow, periodFast),
                () -> new MacdFunction(baseSer, baseVar, periodSlow, periodFast));
    }

    @Override
    protected void computeSpot(int i) {
        emaFast.setDouble(i, ema(i, baseVar, periodFast));
        emaSlow.setDouble(i, ema(i, baseVar, periodSlow));
        macd.setDouble(i, emaFast.getDouble(i) - emaSlow.getDouble(i));
    }

    public double macd(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return macd.getDouble(idx);
    }
}
