package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Bollinger bands of the close with two band widths. */
public final class BollIndicator extends Indicator {
    public static final Factor PERIOD = Factor.of("Period", 20);
    public static final Factor ALPHA1 = Factor.of("Alpha1", 2.0, 0.1);
    public static final Factor ALPHA2 = Factor.of("Alpha2", 2.0, 0.1);

    private final Factor period;
    private final Factor alpha1;
    private final Factor alpha2;

    private final DoubleVar middle;
    private final DoubleVar upper1;
    private final DoubleVar lower1;
    private final DoubleVar upper2;
    private final DoubleVar lower2;

    public BollIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD, ALPHA1, ALPHA2);
    }

    public BollIndicator(BaseSeries baseSer, Factor period, Factor alpha1, Factor alpha2) {
        super(baseSer, "BOLL");
        this.period = factor(period);
        this.alpha1 = factor(alpha1);
        this.alpha2 = factor(alpha2);
        this.middle = addOutput("MIDDLE");
        this.upper1 = addOutput("UPPER1");
        this.lower1 = addOutput("LOWER1");
        this.upper2 = addOutput("UPPER2");
        this.lower2 = addOutput("LOWER2");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            middle.setDouble(i, bollMiddle(i, C, period, alpha1));
            upper1.setDouble(i, bollUpper(i, C, period, alpha1));
            lower1.setDouble(i, bollLower(i, C, period, alpha1));
            upper2.setDouble(i, bollUpper(i, C, period, alpha2));
            lower2.setDouble(i, bollLower(i, C, period, alpha2));
        }
    }
}
