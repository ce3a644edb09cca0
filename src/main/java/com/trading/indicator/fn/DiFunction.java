package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Directional indicators +DI / -DI: averaged directional movement as a
 * percentage of the averaged true range.
 */
public final class DiFunction extends Function {
    private final Factor period;

    private final DoubleVar dmPlus;
    private final DoubleVar dmMinus;
    private final DoubleVar tr;
    private final DoubleVar diPlus;
    private final DoubleVar diMinus;

    private DiFunction(BaseSeries baseSer, Factor period) {
        super(baseSer, "DI(" + period + ")");
        this.period = requirePeriod(period);
        this.dmPlus = doubleVar("dmPlus");
        this.dmMinus = doubleVar("dmMinus");
        this.tr = doubleVar("tr");
        this.diPlus = doubleVar("diPlus");
        this.diMinus = doubleVar("diMinus");
    }

    public static DiFunction of(BaseSeries baseSer, Factor period) {
        return baseSer.function(FunctionKey.of(DiFunction.class, period), () -> new DiFunction(baseSer, period));
    }

    @Override
    protected void computeSpot(int i) {
        dmPlus.setDouble(i, dmPlus(i));
        dmMinus.setDouble(i, dmMinus(i));
        tr.setDouble(i, tr(i));

        if (i < period.value()) {
            diPlus.setDouble(i, Null.DOUBLE);
            diMinus.setDouble(i, Null.DOUBLE);
        } else {
            double dmPlusMa = ma(i, dmPlus, period);
            double dmMinusMa = ma(i, dmMinus, period);
            double trMa = ma(i, tr, period);

            diPlus.setDouble(i, trMa == 0 ? 0.0 : dmPlusMa / trMa * 100.0);
            diMinus.setDouble(i, trMa == 0 ? 0.0 : dmMinusMa / trMa * 100.0);
        }
    }

    public double diPlus(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return diPlus.getDouble(idx);
    }

    public double diMinus(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return diMinus.getDouble(idx);
    }
}
