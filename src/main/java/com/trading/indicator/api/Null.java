package com.trading.indicator.api;

/**
 * The "not applicable at this index" marker.
 *
 * <p>
 * Double columns use {@code NaN}, object columns use {@code null}. The marker
 * is never coerced to zero: formulas that read a value which may be Null must
 * check for it explicitly.
 */
public final class Null {

    public static final double DOUBLE = Double.NaN;

    private Null() {
    }

    public static boolean is(double value) {
        return Double.isNaN(value);
    }

    public static boolean is(Object value) {
        return value == null || (value instanceof Double d && Double.isNaN(d));
    }
}
