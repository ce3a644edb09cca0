package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.engine.AbstractFormula;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * A user-facing study over a base series: a set of named output columns
 * filled from the shared functions of the series.
 *
 * <p>
 * Unlike a {@link com.trading.indicator.engine.Function}, an indicator is not
 * shared through the registry and keeps no memo of its own; it is refreshed
 * explicitly with {@link #computeFrom(long, long)}. All operators it calls run
 * in the session passed to that call, so indicators refreshed in the same
 * session share every common sub-computation.
 */
public abstract class Indicator extends AbstractFormula {
    private final String name;
    private final Map<String, Factor> factors = new LinkedHashMap<>();
    private final Map<String, DoubleVar> outputs = new LinkedHashMap<>();
    private final ObjectVar<Side> signals;

    private long sessionId = Long.MIN_VALUE;
    private volatile long computedTime = Long.MIN_VALUE;

    protected Indicator(BaseSeries baseSer, String name) {
        super(baseSer);
        this.name = name;
        this.signals = objectVar("signals");
    }

    /** Registers a factor under its name and returns it. */
    protected final Factor factor(Factor factor) {
        if (factors.putIfAbsent(factor.name(), factor) != null)
            throw new IllegalArgumentException(name + ": duplicate factor '" + factor.name() + "'");
        return factor;
    }

    /** Creates an output column published under {@code outputName}. */
    protected final DoubleVar addOutput(String outputName) {
        DoubleVar v = doubleVar(outputName);
        if (outputs.putIfAbsent(outputName, v) != null)
            throw new IllegalArgumentException(name + ": duplicate output '" + outputName + "'");
        return v;
    }

    /**
     * Recomputes the outputs from {@code fromTime} to the end of the axis.
     *
     * <p>
     * {@code fromTime} is mapped to the first time point at or after it. After
     * an in-place update of the last bar, pass that bar's time in a new session
     * so the shared functions recompute it.
     *
     * @param sessionId Session shared by every indicator of one refresh pass.
     * @param fromTime  Earliest time to recompute; {@link Long#MIN_VALUE} for
     *                  everything.
     */
    public final void computeFrom(long sessionId, long fromTime) {
        Lock readLock = axis.readLock();
        readLock.lock();
        try {
            this.sessionId = sessionId;
            int size = axis.size();
            if (size == 0) {
                return;
            }
            int fromIdx = axis.ceilingIndexOf(fromTime);

            ensureVarsCapacity();
            compute(fromIdx, size);

            computedTime = axis.lastTime();
        } finally {
            readLock.unlock();
        }
    }

    /** Fills the outputs for indices {@code fromIdx} until {@code size}, exclusive. */
    protected abstract void compute(int fromIdx, int size);

    @Override
    protected final long currentSessionId() {
        return sessionId;
    }

    public final String name() {
        return name;
    }

    /** Time of the last bar seen by the latest refresh, or {@link Long#MIN_VALUE}. */
    public final long computedTime() {
        return computedTime;
    }

    public final Map<String, Factor> factors() {
        return Collections.unmodifiableMap(factors);
    }

    public final Map<String, DoubleVar> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /** @throws IllegalArgumentException if there is no such output. */
    public final DoubleVar output(String outputName) {
        DoubleVar v = outputs.get(outputName);
        if (v == null)
            throw new IllegalArgumentException(name + ": no output '" + outputName + "', have " + outputs.keySet());
        return v;
    }

    /** Records the trading signal at {@code idx}; {@code null} clears it. */
    protected final void setSignal(int idx, Side side) {
        signals.set(idx, side);
    }

    /** @return The signal raised at {@code idx}, or {@code null}. */
    public final Side signal(int idx) {
        return signals.get(idx);
    }

    // ── Signal tests ────────────────────────────────────────────────

    /** {@code var1} moved from below {@code var2} to at or above it at {@code idx}. */
    protected final boolean crossOver(int idx, DoubleVar var1, DoubleVar var2) {
        return idx > 0
                && var1.getDouble(idx) >= var2.getDouble(idx)
                && var1.getDouble(idx - 1) < var2.getDouble(idx - 1);
    }

    protected final boolean crossOver(int idx, DoubleVar var1, double value) {
        return idx > 0
                && var1.getDouble(idx) >= value
                && var1.getDouble(idx - 1) < value;
    }

    /** {@code var1} moved from at or above {@code var2} to below it at {@code idx}. */
    protected final boolean crossUnder(int idx, DoubleVar var1, DoubleVar var2) {
        return idx > 0
                && var1.getDouble(idx) < var2.getDouble(idx)
                && var1.getDouble(idx - 1) >= var2.getDouble(idx - 1);
    }

    protected final boolean crossUnder(int idx, DoubleVar var1, double value) {
        return idx > 0
                && var1.getDouble(idx) < value
                && var1.getDouble(idx - 1) >= value;
    }

    /** A local minimum at {@code idx - 1}. */
    protected final boolean turnUp(int idx, DoubleVar var) {
        return idx > 1
                && var.getDouble(idx) > var.getDouble(idx - 1)
                && var.getDouble(idx - 1) <= var.getDouble(idx - 2);
    }

    /** A local maximum at {@code idx - 1}. */
    protected final boolean turnDown(int idx, DoubleVar var) {
        return idx > 1
                && var.getDouble(idx) < var.getDouble(idx - 1)
                && var.getDouble(idx - 1) >= var.getDouble(idx - 2);
    }

    @Override
    public String toString() {
        return name + factors.values();
    }
}
