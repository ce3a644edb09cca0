package com.trading.indicator.fn;

import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Directional movement.
 *
 * <p>
 * +DM is the rise of the high, -DM the fall of the low, against the previous
 * bar. When both move outward only the larger one counts; inside bars and
 * bars that move only one side count as no movement.
 */
public final class DmFunction extends Function {
    private final DoubleVar dmPlus;
    private final DoubleVar dmMinus;

    private DmFunction(BaseSeries baseSer) {
        super(baseSer, "DM");
        this.dmPlus = doubleVar("dmPlus");
        this.dmMinus = doubleVar("dmMinus");
    }

    public static DmFunction of(BaseSeries baseSer) {
        return baseSer.function(FunctionKey.of(DmFunction.class), () -> new DmFunction(baseSer));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            dmPlus.setDouble(i, Null.DOUBLE);
            dmMinus.setDouble(i, Null.DOUBLE);
            return;
        }

        double h = H.getDouble(i), prevH = H.getDouble(i - 1);
        double l = L.getDouble(i), prevL = L.getDouble(i - 1);
        double up = h - prevH;
        double down = prevL - l;

        double plus = 0.0;
        double minus = 0.0;
        if (h > prevH && l > prevL) {
            plus = up;
        } else if (h < prevH && l < prevL) {
            minus = down;
        } else if (h > prevH && l < prevL) {
            if (up > down) {
                plus = up;
            } else {
                minus = down;
            }
        }
        dmPlus.setDouble(i, plus);
        dmMinus.setDouble(i, minus);
    }

    public double dmPlus(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return dmPlus.getDouble(idx);
    }

    public double dmMinus(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return dmMinus.getDouble(idx);
    }
}
