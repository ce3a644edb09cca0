package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

/**
 * Zigzag turning points of the bars, confirmed and tentative.
 *
 * <p>
 * The columns are Null everywhere except at turning points. A refresh scans
 * ahead of each index to settle it, so the tail after the last confirmed turn
 * costs more than the rest.
 */
public final class ZigzagIndicator extends Indicator {
    public static final Factor PERCENT = Factor.of("Turn Percent", 0.03, 0.01);

    private final Factor percent;

    private final DoubleVar zigzag;
    private final DoubleVar pseudoZigzag;

    public ZigzagIndicator(BaseSeries baseSer) {
        this(baseSer, PERCENT);
    }

    public ZigzagIndicator(BaseSeries baseSer, Factor percent) {
        super(baseSer, "ZIGZAG");
        this.percent = factor(percent);
        this.zigzag = addOutput("ZIGZAG");
        this.pseudoZigzag = addOutput("PSEUDO");
    }

    @Override
    protected void compute(int fromIdx, int size) {
        if (fromIdx < size) {
            // refresh the requested index first, earlier ones are then memoized for this session
            zigzagSide(fromIdx, percent);
        }
        // a turning point confirmed now lies before fromIdx, so start from the earliest it can be
        int start = Math.min(fromIdx, lastTurnBefore(fromIdx));
        for (int i = start; i < size; i++) {
            zigzag.setDouble(i, zigzag(i, percent));
            pseudoZigzag.setDouble(i, pseudoZigzag(i, percent));
        }
    }

    private int lastTurnBefore(int idx) {
        for (int i = Math.min(idx, axis.size()) - 1; i >= 0; i--) {
            if (!Null.is(zigzag.getDouble(i))) {
                return i;
            }
        }
        return 0;
    }
}
