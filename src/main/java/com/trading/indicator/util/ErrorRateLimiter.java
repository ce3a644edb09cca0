package com.trading.indicator.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of warnings for a failure that repeats on every refresh,
 * such as a function that throws on the same bad bar each session. Messages
 * dropped inside an interval are counted and reported with the next one.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private volatile boolean loggedOnce;

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        if (minIntervalMillis < 0)
            throw new IllegalArgumentException("minIntervalMillis must be >= 0: " + minIntervalMillis);
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return Whether the message was logged rather than suppressed. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (!loggedOnce || now - last >= minIntervalNanos) {
            // only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now)) {
                loggedOnce = true;
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0) {
                    logger.warn("{} ({} similar suppressed)", message, dropped, t);
                } else {
                    logger.warn(message, t);
                }
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
