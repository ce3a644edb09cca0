package com.trading.indicator.util;

import com.trading.indicator.api.ComputeListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Aggregates computation statistics per function to find the expensive ones,
 * and warns (throttled) about compute errors.
 *
 * <p>
 * Nested functions are timed inclusively: the duration reported for a
 * function includes the time spent computing the functions it reads.
 */
@Log4j2
public class FunctionProfileListener implements ComputeListener {

    public static class FunctionStats {
        public final String name;
        public long calls;
        public long spots;
        public long errors;
        public long totalDurationNanos;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public FunctionStats(String name) {
            this.name = name;
        }

        synchronized void update(int spotCount, long duration) {
            calls++;
            spots += spotCount;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        synchronized void error() {
            errors++;
        }

        /** Average cost of one computed index. */
        public synchronized double avgMicrosPerSpot() {
            return spots == 0 ? 0 : totalDurationNanos / (double) spots / 1000.0;
        }
    }

    private final Map<String, FunctionStats> stats = new ConcurrentHashMap<>();
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);

    @Override
    public void onComputeStart(long sessionId, String functionName, int fromIdx, int toIdx) {
        // timing comes with onComputeEnd
    }

    @Override
    public void onComputeEnd(long sessionId, String functionName, int spots, long durationNanos) {
        stats.computeIfAbsent(functionName, FunctionStats::new).update(spots, durationNanos);
    }

    @Override
    public void onComputeError(long sessionId, String functionName, int index, Throwable error) {
        stats.computeIfAbsent(functionName, FunctionStats::new).error();
        errLimiter.log(String.format("Compute failure in %s at index %d (session %d): %s",
                functionName, index, sessionId, error.getMessage()), error);
    }

    /** @return Stats of one function, or {@code null} if it never reported. */
    public FunctionStats stats(String functionName) {
        return stats.get(functionName);
    }

    /** Clears all collected statistics. */
    public void reset() {
        stats.clear();
    }

    /** Returns a table of function statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-40s | %8s | %10s | %6s | %12s | %10s%n",
                "Function", "Calls", "Spots", "Errors", "Avg/spot(us)", "Max (us)"));
        sb.append("-----------------------------------------------------------------------------------------------------\n");

        // sort on a snapshot, totals keep moving while functions compute
        Map<FunctionStats, Long> totals = new HashMap<>();
        for (FunctionStats s : stats.values()) {
            synchronized (s) {
                totals.put(s, s.totalDurationNanos);
            }
        }
        List<FunctionStats> valid = new ArrayList<>(totals.keySet());
        valid.sort((s1, s2) -> Long.compare(totals.get(s2), totals.get(s1)));

        for (FunctionStats s : valid) {
            synchronized (s) {
                sb.append(String.format("%-40s | %8d | %10d | %6d | %12.3f | %10.2f%n",
                        truncate(s.name, 40),
                        s.calls,
                        s.spots,
                        s.errors,
                        s.avgMicrosPerSpot(),
                        s.calls == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
            }
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
