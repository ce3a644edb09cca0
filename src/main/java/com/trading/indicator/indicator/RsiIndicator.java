package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Relative strength index. Signals when RSI climbs back over the oversold
 * line or falls back under the overbought line.
 */
public final class RsiIndicator extends Indicator {
    public static final Factor PERIOD = Factor.of("Period", 14);
    public static final Factor OVERSOLD = Factor.of("Oversold", 30);
    public static final Factor OVERBOUGHT = Factor.of("Overbought", 70);

    private final Factor period;
    private final Factor oversold;
    private final Factor overbought;

    private final DoubleVar rsi;

    public RsiIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD, OVERSOLD, OVERBOUGHT);
    }

    public RsiIndicator(BaseSeries baseSer, Factor period, Factor oversold, Factor overbought) {
        super(baseSer, "RSI");
        if (oversold.value() >= overbought.value())
            throw new IllegalArgumentException("RSI oversold must be below overbought: " + oversold + ", " + overbought);
        this.period = factor(period);
        this.oversold = factor(oversold);
        this.overbought = factor(overbought);
        this.rsi = addOutput("RSI");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            rsi.setDouble(i, rsi(i, period));

            if (crossOver(i, rsi, oversold.value())) {
                setSignal(i, Side.ENTER_LONG);
            } else if (crossUnder(i, rsi, overbought.value())) {
                setSignal(i, Side.EXIT_LONG);
            } else {
                setSignal(i, null);
            }
        }
    }
}
