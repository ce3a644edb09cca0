package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Stochastics K, D and J. Signals when K turns up below the oversold line or
 * turns down above the overbought line.
 */
public final class KdIndicator extends Indicator {
    public static final Factor PERIOD = Factor.of("Period K", 9);
    public static final Factor PERIOD_K = Factor.of("Period K Smoothing", 3);
    public static final Factor PERIOD_D = Factor.of("Period D Smoothing", 3);

    static final double OVERSOLD = 20;
    static final double OVERBOUGHT = 80;

    private final Factor period;
    private final Factor periodK;
    private final Factor periodD;

    private final DoubleVar k;
    private final DoubleVar d;
    private final DoubleVar j;

    public KdIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD, PERIOD_K, PERIOD_D);
    }

    public KdIndicator(BaseSeries baseSer, Factor period, Factor periodK, Factor periodD) {
        super(baseSer, "KD");
        this.period = factor(period);
        this.periodK = factor(periodK);
        this.periodD = factor(periodD);
        this.k = addOutput("K");
        this.d = addOutput("D");
        this.j = addOutput("J");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            k.setDouble(i, stochK(i, period, periodK));
            d.setDouble(i, stochD(i, period, periodK, periodD));
            j.setDouble(i, stochJ(i, period, periodK, periodD));

            if (turnUp(i, k) && k.getDouble(i - 1) < OVERSOLD) {
                setSignal(i, Side.ENTER_LONG);
            } else if (turnDown(i, k) && k.getDouble(i - 1) > OVERBOUGHT) {
                setSignal(i, Side.EXIT_LONG);
            } else {
                setSignal(i, null);
            }
        }
    }
}
