package com.trading.indicator.api;

/**
 * Observability hook for function computation.
 *
 * <p>
 * Registered on a base series, it receives a callback around every
 * {@code computeTo} call that actually computes spots (memoized no-op calls are
 * not reported). The callbacks run inside the caller's computation while the
 * time axis read lock is held, so implementations must be cheap and must not
 * append to the series.
 */
public interface ComputeListener {

    /**
     * @param sessionId    Session of the computation.
     * @param functionName Display name of the function, e.g. "MA(close, Period=5)".
     * @param fromIdx      First index that will be computed.
     * @param toIdx        Last index that will be computed.
     */
    void onComputeStart(long sessionId, String functionName, int fromIdx, int toIdx);

    /**
     * @param spots         Number of {@code computeSpot} invocations.
     * @param durationNanos Wall time of the spot loop.
     */
    void onComputeEnd(long sessionId, String functionName, int spots, long durationNanos);

    /** Called before a {@code computeSpot} failure is re-thrown to the caller. */
    void onComputeError(long sessionId, String functionName, int index, Throwable error);
}
