package com.trading.indicator.engine;

import com.trading.indicator.api.ComputeListener;
import com.trading.indicator.api.Factor;
import com.trading.indicator.series.BaseSeries;

import java.util.concurrent.locks.Lock;
import java.util.function.IntPredicate;

/**
 * An incrementally computed, memoized formula over the shared time axis.
 *
 * <p>
 * A function owns one or more columns and a high-water mark,
 * {@code computedIdx}. {@link #computeTo(long, int)} extends the columns from
 * the mark up to the requested index by calling {@link #computeSpot(int)} once
 * per new index. A spot may read index {@code i} and earlier of any column,
 * including columns of other functions obtained through the base series
 * registry; those calls run in the same session, so shared ancestors in the
 * dependency graph are computed once per session no matter how many paths
 * reach them.
 *
 * <h3>States</h3>
 * <ul>
 * <li>Uninitialized: {@code computedIdx == -1}, no session.</li>
 * <li>Partially computed: {@code computedIdx < size - 1}.</li>
 * <li>Fully computed: {@code computedIdx == size - 1} as of the last call.</li>
 * </ul>
 * Axis growth always allows another extension; there is no terminal state.
 *
 * <h3>Sessions</h3>
 * The caller supplies the session id, typically one per refresh pass. Within a
 * session a request at or below {@code computedIdx} is a no-op. A request from
 * a new session recomputes from {@code min(computedIdx + 1, idx)}: indices
 * before the target stay memoized across sessions, and the target itself is
 * recomputed so that an in-place update of the forming last bar is seen.
 * {@code computedIdx} never decreases.
 *
 * <h3>Threading</h3>
 * The axis read lock is held for the whole call, which excludes appends.
 * {@code sessionId} and {@code computedIdx} are not otherwise guarded: the host
 * must not drive one function graph from two threads with different sessions
 * at the same time. If it does, the memoization check may let duplicate work
 * through; writes are idempotent per index, so the result is still a correct
 * column, only computed twice.
 */
public abstract class Function extends AbstractFormula {
    private final String name;

    private long sessionId = Long.MIN_VALUE;
    private int computedIdx = -1;

    protected Function(BaseSeries baseSer, String name) {
        super(baseSer);
        this.name = name;
    }

    /**
     * Computes this function up to {@code idx}, reusing previous work.
     *
     * <p>
     * A negative {@code idx} computes nothing. An {@code idx} past the end of
     * the axis is clamped to the last index. Exceptions from
     * {@link #computeSpot(int)} are reported to the series' compute listener and
     * re-thrown; {@code computedIdx} and the session are left at their previous values.
     *
     * @param sessionId Caller's session, see class docs.
     * @param idx       Target index, inclusive.
     */
    public final void computeTo(long sessionId, int idx) {
        Lock readLock = axis.readLock();
        readLock.lock();
        try {
            preComputeTo(sessionId, idx);

            if (this.sessionId == sessionId && idx <= computedIdx) {
                return;
            }
            final long prevSessionId = this.sessionId;
            this.sessionId = sessionId;

            // computedIdx itself is done, so start after it unless a new session targets it
            int fromIdx = Math.max(Math.min(computedIdx + 1, idx), 0);
            int toIdx = Math.min(idx, axis.size() - 1);
            if (fromIdx > toIdx) {
                return;
            }

            ensureVarsCapacity();

            final ComputeListener l = baseSer.computeListener();
            long start = 0;
            if (l != null) {
                l.onComputeStart(sessionId, name, fromIdx, toIdx);
                start = System.nanoTime();
            }

            int i = fromIdx;
            try {
                for (; i <= toIdx; i++) {
                    computeSpot(i);
                }
            } catch (RuntimeException | Error e) {
                // a retry in this session must not hit the memoized fast path
                this.sessionId = prevSessionId;
                if (l != null) {
                    l.onComputeError(sessionId, name, i, e);
                }
                throw e;
            }

            if (toIdx > computedIdx) {
                computedIdx = toIdx;
            }

            if (l != null) {
                l.onComputeEnd(sessionId, name, toIdx - fromIdx + 1, System.nanoTime() - start);
            }

            postComputeTo(sessionId, toIdx);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Lookahead access: computes index by index from {@code idx} until
     * {@code terminal} accepts an index or the axis ends.
     *
     * <p>
     * Only for formulas whose value at {@code idx} is settled by something that
     * happens later (a turning point). {@link #computeTo(long, int)} itself stays
     * strictly causal. The read lock is held across the whole scan.
     *
     * @param terminal Tested after each index has been computed.
     */
    protected final void computeUntil(long sessionId, int idx, IntPredicate terminal) {
        Lock readLock = axis.readLock();
        readLock.lock();
        try {
            final int size = axis.size();
            for (int i = Math.max(idx, 0); i < size; i++) {
                computeTo(sessionId, i);
                if (terminal.test(i)) {
                    break;
                }
            }
        } finally {
            readLock.unlock();
        }
    }

    /** Hook run before the memoization check, under the read lock. */
    protected void preComputeTo(long sessionId, int idx) {
    }

    /** Hook run after {@code computedIdx} has been advanced to {@code toIdx}. */
    protected void postComputeTo(long sessionId, int toIdx) {
    }

    /**
     * Computes and stores this function's outputs at index {@code i}. May read
     * index {@code i} and earlier of any column, never later indices of its own
     * columns.
     */
    protected abstract void computeSpot(int i);

    @Override
    protected final long currentSessionId() {
        return sessionId;
    }

    /** @throws IllegalArgumentException if {@code period} is below 1. */
    protected static Factor requirePeriod(Factor period) {
        if (period == null || period.value() < 1)
            throw new IllegalArgumentException("Period must be >= 1: " + period);
        return period;
    }

    public final String name() {
        return name;
    }

    public final int computedIdx() {
        return computedIdx;
    }

    public final long sessionId() {
        return sessionId;
    }

    @Override
    public String toString() {
        return name + "[computedIdx=" + computedIdx + "]";
    }
}
