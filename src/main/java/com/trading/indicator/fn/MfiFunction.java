package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Money flow index: positive money flow as a percentage of total money flow
 * over {@code period} bars. Money flow is typical price times volume, signed by
 * the direction of the typical price.
 */
public final class MfiFunction extends Function {
    private final Factor period;

    private final DoubleVar tp;
    private final DoubleVar mfPos;
    private final DoubleVar mfNeg;
    private final DoubleVar mfi;

    private MfiFunction(BaseSeries baseSer, Factor period) {
        super(baseSer, "MFI(" + period + ")");
        this.period = requirePeriod(period);
        this.tp = doubleVar("tp");
        this.mfPos = doubleVar("mfPos");
        this.mfNeg = doubleVar("mfNeg");
        this.mfi = doubleVar("mfi");
    }

    public static MfiFunction of(BaseSeries baseSer, Factor period) {
        return baseSer.function(FunctionKey.of(MfiFunction.class, period), () -> new MfiFunction(baseSer, period));
    }

    @Override
    protected void computeSpot(int i) {
        tp.setDouble(i, (H.getDouble(i) + C.getDouble(i) + L.getDouble(i)) / 3.0);

        if (i == 0) {
            mfPos.setDouble(i, 0.0);
            mfNeg.setDouble(i, 0.0);
        } else {
            double tpNow = tp.getDouble(i);
            double tpPrev = tp.getDouble(i - 1);
            mfPos.setDouble(i, tpNow > tpPrev ? tpNow * V.getDouble(i) : 0.0);
            mfNeg.setDouble(i, tpNow < tpPrev ? tpNow * V.getDouble(i) : 0.0);
        }

        if (i < period.value() - 1) {
            mfi.setDouble(i, Null.DOUBLE);
        } else {
            double pos = sum(i, mfPos, period);
            double neg = sum(i, mfNeg, period);
            mfi.setDouble(i, pos + neg == 0 ? 0.0 : pos / (pos + neg) * 100.0);
        }
    }

    public double mfi(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return mfi.getDouble(idx);
    }
}
