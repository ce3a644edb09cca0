package com.trading.indicator.util;

import com.trading.indicator.api.ComputeListener;

import java.util.Arrays;

/**
 * Fans compute callbacks out to several {@link ComputeListener}s, so a profiler
 * and an error logger can be attached to one base series.
 */
public class CompositeComputeListener implements ComputeListener {
    private volatile ComputeListener[] listeners = new ComputeListener[0];

    public synchronized CompositeComputeListener add(ComputeListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        ComputeListener[] old = listeners;
        ComputeListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onComputeStart(long sessionId, String functionName, int fromIdx, int toIdx) {
        for (ComputeListener l : listeners)
            l.onComputeStart(sessionId, functionName, fromIdx, toIdx);
    }

    @Override
    public void onComputeEnd(long sessionId, String functionName, int spots, long durationNanos) {
        for (ComputeListener l : listeners)
            l.onComputeEnd(sessionId, functionName, spots, durationNanos);
    }

    @Override
    public void onComputeError(long sessionId, String functionName, int index, Throwable error) {
        for (ComputeListener l : listeners)
            l.onComputeError(sessionId, functionName, index, error);
    }
}
