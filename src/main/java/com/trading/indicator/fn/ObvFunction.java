package com.trading.indicator.fn;

import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** On-balance volume. Starts at zero. */
public final class ObvFunction extends Function {
    private final DoubleVar obv;

    private ObvFunction(BaseSeries baseSer) {
        super(baseSer, "OBV");
        this.obv = doubleVar("obv");
    }

    public static ObvFunction of(BaseSeries baseSer) {
        return baseSer.function(FunctionKey.of(ObvFunction.class), () -> new ObvFunction(baseSer));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            obv.setDouble(i, 0.0);
            return;
        }
        double prev = obv.getDouble(i - 1);
        double close = C.getDouble(i);
        double prevClose = C.getDouble(i - 1);
        if (close > prevClose) {
            obv.setDouble(i, prev + V.getDouble(i));
        } else if (close < prevClose) {
            obv.setDouble(i, prev - V.getDouble(i));
        } else {
            obv.setDouble(i, prev);
        }
    }

    public double obv(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return obv.getDouble(idx);
    }
}
