package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * AR/BR sentiment ratios.
 *
 * <p>
 * AR compares the push above the open with the drop below it:
 * {@code sum(H - O) / sum(O - L) * 100}. BR compares the same for the close:
 * {@code sum(max(0, H - C)) / sum(max(0, C - L)) * 100}. Both are Null during
 * the warm-up and where the denominator sums to 0.
 */
public final class ArbrIndicator extends Indicator {
    public static final Factor PERIOD = Factor.of("Period", 10);

    private final Factor period;

    private final DoubleVar up;
    private final DoubleVar dn;
    private final DoubleVar bs;
    private final DoubleVar ss;

    private final DoubleVar ar;
    private final DoubleVar br;

    public ArbrIndicator(BaseSeries baseSer) {
        this(baseSer, PERIOD);
    }

    public ArbrIndicator(BaseSeries baseSer, Factor period) {
        super(baseSer, "ARBR");
        this.period = factor(period);
        this.up = doubleVar("up");
        this.dn = doubleVar("dn");
        this.bs = doubleVar("bs");
        this.ss = doubleVar("ss");
        this.ar = addOutput("AR");
        this.br = addOutput("BR");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            up.setDouble(i, H.getDouble(i) - O.getDouble(i));
            dn.setDouble(i, O.getDouble(i) - L.getDouble(i));
            bs.setDouble(i, Math.max(0, H.getDouble(i) - C.getDouble(i)));
            ss.setDouble(i, Math.max(0, C.getDouble(i) - L.getDouble(i)));

            ar.setDouble(i, ratio(sum(i, up, period), sum(i, dn, period)));
            br.setDouble(i, ratio(sum(i, bs, period), sum(i, ss, period)));
        }
    }

    private static double ratio(double numerator, double denominator) {
        return denominator == 0 ? Null.DOUBLE : numerator / denominator * 100.0;
    }
}
