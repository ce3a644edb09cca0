package com.trading.indicator.fn;

import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** True range: the largest of high-low and the gaps to the previous close. */
public final class TrFunction extends Function {
    private final DoubleVar tr;

    private TrFunction(BaseSeries baseSer) {
        super(baseSer, "TR");
        this.tr = doubleVar("tr");
    }

    public static TrFunction of(BaseSeries baseSer) {
        return baseSer.function(FunctionKey.of(TrFunction.class), () -> new TrFunction(baseSer));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            tr.setDouble(i, Null.DOUBLE);
        } else {
            double prevClose = C.getDouble(i - 1);
            double range = Math.max(H.getDouble(i) - L.getDouble(i), Math.abs(H.getDouble(i) - prevClose));
            tr.setDouble(i, Math.max(range, Math.abs(L.getDouble(i) - prevClose)));
        }
    }

    public double tr(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return tr.getDouble(idx);
    }
}
