package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Three simple moving averages of the close. */
public final class MaIndicator extends Indicator {
    public static final Factor PERIOD1 = Factor.of("Period 1", 5);
    public static final Factor PERIOD2 = Factor.of("Period 2", 10);
    public static final Factor PERIOD3 = Factor.of("Period 3", 20);

    private final Factor period1;
    private final Factor period2;
    private final Factor period3;

    private final DoubleVar ma1;
    private final DoubleVar ma2;
    private final DoubleVar ma3;

    public MaIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD1, PERIOD2, PERIOD3);
    }

    public MaIndicator(BaseSeries baseSer, Factor period1, Factor period2, Factor period3) {
        super(baseSer, "MA");
        this.period1 = factor(period1);
        this.period2 = factor(period2);
        this.period3 = factor(period3);
        this.ma1 = addOutput("MA1");
        this.ma2 = addOutput("MA2");
        this.ma3 = addOutput("MA3");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            ma1.setDouble(i, ma(i, C, period1));
            ma2.setDouble(i, ma(i, C, period2));
            ma3.setDouble(i, ma(i, C, period3));
        }
    }
}
