package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;

/**
 * Parabolic stop-and-reverse.
 *
 * <p>
 * Starts long at the first low. Each bar the stop moves toward the extreme
 * point by the acceleration factor, which grows by {@code step} on every new
 * extreme up to {@code maximum}. When price crosses the stop the side flips,
 * the stop jumps to the current extreme and the factor resets to
 * {@code initial}.
 */
public final class SarFunction extends Function {
    private final Factor initial;
    private final Factor step;
    private final Factor maximum;

    private final ObjectVar<Side> side;
    private final DoubleVar ep;
    private final DoubleVar af;
    private final DoubleVar sar;

    private SarFunction(BaseSeries baseSer, Factor initial, Factor step, Factor maximum) {
        super(baseSer, "SAR(" + initial + ", " + step + ", " + maximum + ")");
        if (initial.value() <= 0 || step.value() <= 0 || maximum.value() < initial.value())
            throw new IllegalArgumentException("Invalid SAR factors: " + initial + ", " + step + ", " + maximum);
        this.initial = initial;
        this.step = step;
        this.maximum = maximum;
        this.side = objectVar("side");
        this.ep = doubleVar("ep");
        this.af = doubleVar("af");
        this.sar = doubleVar("sar");
    }

    public static SarFunction of(BaseSeries baseSer, Factor initial, Factor step, Factor maximum) {
        return baseSer.function(FunctionKey.of(SarFunction.class, initial, step, maximum),
                () -> new SarFunction(baseSer, initial, step, maximum));
    }

    @Override
    protected void computeSpot(int i) {
        if (i == 0) {
            side.set(i, Side.ENTER_LONG);
            sar.setDouble(i, L.getDouble(i));
            af.setDouble(i, initial.value());
            ep.setDouble(i, H.getDouble(i));
            return;
        }

        if (side.get(i - 1) == Side.ENTER_LONG) {
            double high = H.getDouble(i);
            if (high > ep.getDouble(i - 1)) {
                af.setDouble(i, Math.min(af.getDouble(i - 1) + step.value(), maximum.value()));
                ep.setDouble(i, high);
            } else {
                af.setDouble(i, af.getDouble(i - 1));
                ep.setDouble(i, ep.getDouble(i - 1));
            }
            double prevSar = sar.getDouble(i - 1);
            sar.setDouble(i, prevSar + af.getDouble(i) * (H.getDouble(i - 1) - prevSar));

            if (sar.getDouble(i) >= high) {
                // reverse to short
                side.set(i, Side.EXIT_LONG);
                sar.setDouble(i, high);
                af.setDouble(i, initial.value());
                ep.setDouble(i, L.getDouble(i));
            } else {
                side.set(i, Side.ENTER_LONG);
            }
        } else {
            double low = L.getDouble(i);
            if (low < ep.getDouble(i - 1)) {
                af.setDouble(i, Math.min(af.getDouble(i - 1) + step.value(), maximum.value()));
                ep.setDouble(i, low);
            } else {
                af.setDouble(i, af.getDouble(i - 1));
                ep.setDouble(i, ep.getDouble(i - 1));
            }
            double prevSar = sar.getDouble(i - 1);
            sar.setDouble(i, prevSar + af.getDouble(i) * (L.getDouble(i - 1) - prevSar));

            if (sar.getDouble(i) <= low) {
                // reverse to long
                side.set(i, Side.ENTER_LONG);
                sar.setDouble(i, low);
                af.setDouble(i, initial.value());
                ep.setDouble(i, H.getDouble(i));
            } else {
                side.set(i, Side.EXIT_LONG);
            }
        }
    }

    public double sar(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return sar.getDouble(idx);
    }

    public Side sarSide(long sessionId, int idx) {
        computeTo(sessionId, idx);
        return side.get(idx);
    }
}
