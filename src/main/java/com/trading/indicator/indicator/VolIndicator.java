package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/** Volume with a short and a medium moving average of it. */
public final class VolIndicator extends Indicator {
    public static final Factor PERIOD1 = Factor.of("Period Short", 5);
    public static final Factor PERIOD2 = Factor.of("Period Medium", 10);

    private final Factor period1;
    private final Factor period2;

    private final DoubleVar vol;
    private final DoubleVar ma1;
    private final DoubleVar ma2;

    public VolIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD1, PERIOD2);
    }

    public VolIndicator(BaseSeries baseSer, Factor period1, Factor period2) {
        super(baseSer, "VOL");
        this.period1 = factor(period1);
        this.period2 = factor(period2);
        this.vol = addOutput("VOL");
        this.ma1 = addOutput("MA1");
        this.ma2 = addOutput("MA2");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            vol.setDouble(i, V.getDouble(i));
            ma1.setDouble(i, ma(i, V, period1));
            ma2.setDouble(i, ma(i, V, period2));
        }
    }
}
