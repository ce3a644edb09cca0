package com.trading.indicator.series;

import com.trading.indicator.api.ComputeListener;
import com.trading.indicator.engine.Function;
import com.trading.indicator.engine.FunctionKey;
import com.trading.indicator.engine.FunctionRegistry;

import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * The root of a series family: owns the shared {@link TimeAxis}, the canonical
 * OHLCV columns and the registry of derived functions.
 *
 * <p>
 * Data enters only through {@link #append(Bar)}, {@link #append(List)} and
 * {@link #updateLast(Bar)}, all of which hold the axis write lock, so they wait
 * for in-flight computations and are never observed half-done.
 *
 * <p>
 * Functions are obtained through {@link #function(FunctionKey, Supplier)}: the
 * same key always yields the same instance for the lifetime of the series.
 */
@Log4j2
public class BaseSeries {
    private final String name;
    private final TimeAxis axis = new TimeAxis();

    private final DoubleVar open;
    private final DoubleVar high;
    private final DoubleVar low;
    private final DoubleVar close;
    private final DoubleVar volume;
    private final ObjectVar<Boolean> closed;

    private final FunctionRegistry registry = new FunctionRegistry();
    private volatile ComputeListener computeListener;

    public BaseSeries(String name) {
        this.name = name;
        this.open = new DoubleVar("open", axis);
        this.high = new DoubleVar("high", axis);
        this.low = new DoubleVar("low", axis);
        this.close = new DoubleVar("close", axis);
        this.volume = new DoubleVar("volume", axis);
        this.closed = new ObjectVar<>("closed", axis);
    }

    public String name() {
        return name;
    }

    /**
     * Appends one bar.
     *
     * @throws OutOfOrderTimestampException if the bar is not after the last one.
     */
    public void append(Bar bar) {
        Lock w = axis.writeLock();
        w.lock();
        try {
            axis.appendUnlocked(bar.time());
            write(axis.size() - 1, bar);
        } finally {
            w.unlock();
        }
    }

    /**
     * Appends a batch of bars under a single write-lock acquisition. The whole
     * batch is validated first: on an ordering error nothing is appended.
     *
     * @throws OutOfOrderTimestampException if the batch is not strictly
     *                                      increasing or does not start after
     *                                      the last bar.
     */
    public void append(List<Bar> bars) {
        if (bars.isEmpty())
            return;
        Lock w = axis.writeLock();
        w.lock();
        try {
            long prev = axis.isEmpty() ? Long.MIN_VALUE : axis.lastTime();
            boolean first = axis.isEmpty();
            for (Bar bar : bars) {
                if (!first && bar.time() <= prev) {
                    throw new OutOfOrderTimestampException(prev, bar.time());
                }
                first = false;
                prev = bar.time();
            }
            for (Bar bar : bars) {
                axis.appendUnlocked(bar.time());
                write(axis.size() - 1, bar);
            }
        } finally {
            w.unlock();
        }
        log.debug("{}: appended {} bars, size={}", name, bars.size(), axis.size());
    }

    /**
     * Replaces the values of the last bar in place, typically while it is still
     * forming. Functions pick the change up on their next computation in a new
     * session that targets the last index.
     *
     * @throws IllegalStateException if the series is empty or the bar's time
     *                               differs from the last time point.
     */
    public void updateLast(Bar bar) {
        Lock w = axis.writeLock();
        w.lock();
        try {
            if (axis.isEmpty())
                throw new IllegalStateException(name + ": cannot update last bar of an empty series");
            if (bar.time() != axis.lastTime())
                throw new IllegalStateException(
                        name + ": updateLast time " + bar.time() + " != last time " + axis.lastTime());
            write(axis.size() - 1, bar);
        } finally {
            w.unlock();
        }
    }

    private void write(int idx, Bar bar) {
        open.setDouble(idx, bar.open());
        high.setDouble(idx, bar.high());
        low.setDouble(idx, bar.low());
        close.setDouble(idx, bar.close());
        volume.setDouble(idx, bar.volume());
        closed.set(idx, bar.closed());
    }

    /** Reads the bar at {@code idx} back from the columns. */
    public Bar bar(int idx) {
        Boolean c = closed.get(idx);
        return new Bar(axis.timeOf(idx), open.getDouble(idx), high.getDouble(idx), low.getDouble(idx),
                close.getDouble(idx), volume.getDouble(idx), c != null && c);
    }

    /**
     * Returns the function registered under {@code key}, constructing it with
     * {@code factory} on first request. Concurrent first requests construct it
     * exactly once.
     */
    public <F extends Function> F function(FunctionKey key, Supplier<F> factory) {
        return registry.getOrCreate(key, factory);
    }

    public FunctionRegistry functions() {
        return registry;
    }

    public TimeAxis timeAxis() {
        return axis;
    }

    public int size() {
        return axis.size();
    }

    public DoubleVar open() {
        return open;
    }

    public DoubleVar high() {
        return high;
    }

    public DoubleVar low() {
        return low;
    }

    public DoubleVar close() {
        return close;
    }

    public DoubleVar volume() {
        return volume;
    }

    public ObjectVar<Boolean> isClosed() {
        return closed;
    }

    public ComputeListener computeListener() {
        return computeListener;
    }

    public void setComputeListener(ComputeListener computeListener) {
        this.computeListener = computeListener;
    }

    @Override
    public String toString() {
        return "BaseSeries[" + name + ", size=" + axis.size() + ", functions=" + registry.size() + "]";
    }
}
