package com.trading.indicator.series;

/**
 * Thrown when a timestamp that is not strictly greater than the last one is
 * appended to a {@link TimeAxis}. Signals corrupt upstream data; the axis is
 * left unchanged.
 */
public class OutOfOrderTimestampException extends IllegalArgumentException {

    private final long lastTime;
    private final long rejectedTime;

    public OutOfOrderTimestampException(long lastTime, long rejectedTime) {
        super("Timestamp " + rejectedTime + " is not after last timestamp " + lastTime);
        this.lastTime = lastTime;
        this.rejectedTime = rejectedTime;
    }

    public long lastTime() {
        return lastTime;
    }

    public long rejectedTime() {
        return rejectedTime;
    }
}
