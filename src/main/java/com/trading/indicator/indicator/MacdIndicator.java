package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * MACD line, its EMA signal line and the histogram between them. Signals when
 * the MACD line crosses the signal line.
 */
public final class MacdIndicator extends Indicator {
    public static final Factor PERIOD_FAST = Factor.of("Period EMA Fast", 12);
    public static final Factor PERIOD_SLOW = Factor.of("Period EMA Slow", 26);
    public static final Factor PERIOD_SIGNAL = Factor.of("Period Signal", 9);

    private final Factor periodFast;
    private final Factor periodSlow;
    private final Factor periodSignal;

    private final DoubleVar macd;
    private final DoubleVar signalLine;
    private final DoubleVar histogram;

    public MacdIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD_FAST, PERIOD_SLOW, PERIOD_SIGNAL);
    }

    public MacdIndicator(BaseSeries baseSer, Factor periodFast, Factor periodSlow, Factor periodSignal) {
        super(baseSer, "MACD");
        this.periodFast = factor(periodFast);
        this.periodSlow = factor(periodSlow);
        this.periodSignal = factor(periodSignal);
        this.macd = addOutput("MACD");
        this.signalLine = addOutput("SIGNAL");
        this.histogram = addOutput("HISTOGRAM");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            macd.setDouble(i, macd(i, C, periodSlow, periodFast));
            // the EMA reads this indicator's own MACD column, written just above
            signalLine.setDouble(i, ema(i, macd, periodSignal));
            histogram.setDouble(i, macd.getDouble(i) - signalLine.getDouble(i));

            if (crossOver(i, macd, signalLine)) {
                setSignal(i, Side.ENTER_LONG);
            } else if (crossUnder(i, macd, signalLine)) {
                setSignal(i, Side.EXIT_LONG);
            } else {
                setSignal(i, null);
            }
        }
    }
}
