package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Directional movement: +DI, -DI, ADX and ADXR. Signals when +DI crosses -DI.
 */
public final class DmiIndicator extends Indicator {
    public static final Factor PERIOD_DI = Factor.of("Period DI", 6);
    public static final Factor PERIOD_ADX = Factor.of("Period ADX", 14);

    private final Factor periodDi;
    private final Factor periodAdx;

    private final DoubleVar diPlus;
    private final DoubleVar diMinus;
    private final DoubleVar adx;
    private final DoubleVar adxr;

    public DmiIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD_DI, PERIOD_ADX);
    }

    public DmiIndicator(BaseSeries baseSer, Factor periodDi, Factor periodAdx) {
        super(baseSer, "DMI");
        this.periodDi = factor(periodDi);
        this.periodAdx = factor(periodAdx);
        this.diPlus = addOutput("+DI");
        this.diMinus = addOutput("-DI");
        this.adx = addOutput("ADX");
        this.adxr = addOutput("ADXR");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            diPlus.setDouble(i, diPlus(i, periodDi));
            diMinus.setDouble(i, diMinus(i, periodDi));
            adx.setDouble(i, adx(i, periodDi, periodAdx));
            adxr.setDouble(i, adxr(i, periodDi, periodAdx));

            if (crossOver(i, diPlus, diMinus)) {
                setSignal(i, Side.ENTER_LONG);
            } else if (crossUnder(i, diPlus, diMinus)) {
                setSignal(i, Side.EXIT_LONG);
            } else {
                setSignal(i, null);
            }
        }
    }
}
