package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.api.Side;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;

/**
 * Zigzag turning points: highs and lows separated by reversals of at least
 * {@code percent} (a fraction, 0.03 for 3%).
 *
 * <p>
 * The spot at {@code i} only tracks the running extreme of the current trend.
 * A turning point is written when a later bar reverses the trend, at the index
 * of the extreme, which is in the past. Reading the zigzag at {@code idx}
 * therefore computes forward until the first reversal after {@code idx} (see
 * {@link #zigzag(long, int)}).
 *
 * <p>
 * The pseudo zigzag holds every confirmed turning point plus at most one
 * tentative point: the extreme of the still-open trend. The tentative point is
 * rebuilt each time a computation reaches the last index; the previous one is
 * cleared first unless it has been confirmed meanwhile.
 */
public final class ZigzagFunction extends Function {
    private final Factor percent;

    private final DoubleVar peakHi;
    private final DoubleVar peakLo;
    private final ObjectVar<Integer> peakHiIdx;
    private final ObjectVar<Integer> peakLoIdx;
    private final ObjectVar<Integer> confirmedIdx;
    private final ObjectVar<Side> side;
    private final DoubleVar zigzag;
    private final DoubleVar pseudoZigzag;

    private int tentativeIdx = -1;

    private ZigzagFunction(BaseSeries baseSer, Factor percent) {
        super(baseSer, "ZIGZAG(" + percent + ")");
        if (percent.value() <= 0)
            throw new IllegalArgumentException("Zigzag percent must be > 0: " + percent);
        this.percent = percent;
        this.peakHi = doubleVar("peakHi");
        this.peakLo = doubleVar("peakLo");
        this.peakHiIdx = objectVar("peakHiIdx");
        this.peakLoIdx = objectVar("peakLoIdx");
        this.confirmedIdx = objectVar("confirmedIdx");
        this.side = objectVar("side");
        this.zigzag = doubleVar("zigzag");
        this.pseudoZigzag = doubleVar("pseudoZigzag");
    }

    public static ZigzagFunction of(BaseSeries baseSer, Factor percent) {
        return baseSer.function(FunctionKey.of(ZigzagFunction.class, percent),
                () -> new ZigzagFunction(baseSer, percent));
    }

    @Override
    protected void computeSpot(int i) {
        // a recomputed spot (forming last bar) must not leave its earlier confirmation behind
        Integer previouslyConfirmed = confirmedIdx.get(i);
        if (previouslyConfirmed != null) {
            zigzag.setDouble(previouslyConfirmed, Null.DOUBLE);
            pseudoZigzag.setDouble(previouslyConfirmed, Null.DOUBLE);
            confirmedIdx.set(i, null);
        }

        if (i == 0) {
            side.set(i, Side.ENTER_LONG);
            zigzag.setDouble(i, Null.DOUBLE);
            pseudoZigzag.setDouble(i, Null.DOUBLE);
            peakHi.setDouble(i, H.getDouble(i));
            peakLo.setDouble(i, L.getDouble(i));
            peakHiIdx.set(i, i);
            peakLoIdx.set(i, i);
            return;
        }

        double high = H.getDouble(i);
        double low = L.getDouble(i);

        if (side.get(i - 1) == Side.ENTER_LONG) {
            double prevPeakHi = peakHi.getDouble(i - 1);
            if ((high - prevPeakHi) / prevPeakHi <= -percent.value()) {
                // turn to short: the high of the long trend is a turning point
                side.set(i, Side.EXIT_LONG);
                confirm(i, peakHiIdx.get(i - 1), H);
                peakLo.setDouble(i, low);
                peakLoIdx.set(i, i);
            } else {
                side.set(i, Side.ENTER_LONG);
                if (high > prevPeakHi) {
                    peakHi.setDouble(i, high);
                    peakHiIdx.set(i, i);
                } else {
                    peakHi.setDouble(i, prevPeakHi);
                    peakHiIdx.set(i, peakHiIdx.get(i - 1));
                }
            }
        } else {
            double prevPeakLo = peakLo.getDouble(i - 1);
            if ((low - prevPeakLo) / prevPeakLo >= percent.value()) {
                // turn to long: the low of the short trend is a turning point
                side.set(i, Side.ENTER_LONG);
                confirm(i, peakLoIdx.get(i - 1), L);
                peakHi.setDouble(i, high);
                peakHiIdx.set(i, i);
            } else {
                side.set(i, Side.EXIT_LONG);
                if (low < prevPeakLo) {
                    peakLo.setDouble(i, low);
                    peakLoIdx.set(i, i);
                } else {
                    peakLo.setDouble(i, prevPeakLo);
                    peakLoIdx.set(i, peakLoIdx.get(i - 1));
                }
            }
        }
    }

    private void confirm(int i, int pointIdx, DoubleVar price) {
        double value = price.getDouble(pointIdx);
        zigzag.setDouble(pointIdx, value);
        pseudoZigzag.setDouble(pointIdx, value);
        confirmedIdx.set(i, pointIdx);
    }

    @Override
    protected void postComputeTo(long sessionId, int toIdx) {
        int lastIdx = axis.size() - 1;
        if (toIdx != lastIdx) {
            return;
        }

        if (tentativeIdx >= 0 && Null.is(zigzag.getDouble(tentativeIdx))) {
            pseudoZigzag.setDouble(tentativeIdx, Null.DOUBLE);
        }

        if (side.get(lastIdx) == Side.ENTER_LONG) {
            tentativeIdx = peakHiIdx.get(lastIdx);
            pseudoZigzag.setDouble(tentativeIdx, H.getDouble(tentativeIdx));
        } else {
            tentativeIdx = peakLoIdx.get(lastIdx);
            pseudoZigzag.setDouble(tentativeIdx, L.getDouble(tentativeIdx));
        }
    }

    private boolean isTurn(int i) {
        return i > 0 && side.get(i - 1) != side.get(i);
    }

    /**
     * The confirmed turning point at {@code idx}, or Null. Computes forward
     * until the first reversal after {@code idx}, which settles whether
     * {@code idx} is the extreme of its trend.
     */
    public double zigzag(long sessionId, int idx) {
        computeUntil(sessionId, idx, i -> i > idx && isTurn(i));
        return zigzag.getDouble(idx);
    }

    /** Like {@link #zigzag(long, int)}, including the tentative last extreme. */
    public double pseudoZigzag(long sessionId, int idx) {
        computeUntil(sessionId, idx, i -> i > idx && isTurn(i));
        return pseudoZigzag.getDouble(idx);
    }

    /** The trend side at {@code idx}; known without lookahead. */
    public Side zigzagSide(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return side.get(idx);
    }
}
