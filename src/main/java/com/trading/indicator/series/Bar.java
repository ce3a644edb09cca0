package com.trading.indicator.series;

/**
 * One OHLCV observation.
 *
 * @param time   Epoch millis of the bar.
 * @param closed false while the bar is still forming and may be updated in place.
 */
public record Bar(long time, double open, double high, double low, double close, double volume, boolean closed) {

    public static Bar of(long time, double open, double high, double low, double close, double volume) {
        return new Bar(time, open, high, low, close, volume, true);
    }

    /** A bar whose four prices all equal {@code close}. */
    public static Bar ofClose(long time, double close) {
        return new Bar(time, close, close, close, close, 0.0, true);
    }
}
