package com.trading.indicator.api;

/**
 * An immutable, named numeric parameter of a formula (a period length, a band
 * width, a turn percentage).
 *
 * <p>
 * Factors take part in a function's identity: two requests for the same formula
 * with equal factors share one instance. {@code step}, {@code min} and
 * {@code max} are descriptive metadata for whoever edits the factor and are
 * included in equality like any other component.
 *
 * @param name  Display name, e.g. "Period".
 * @param value The current value.
 * @param step  Suggested increment when tuning.
 * @param min   Lower bound of the sensible range.
 * @param max   Upper bound of the sensible range.
 */
public record Factor(String name, double value, double step, double min, double max) {

    public Factor {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Factor name must not be empty");
        if (Double.isNaN(value))
            throw new IllegalArgumentException("Factor '" + name + "' value must be a number");
        if (min > max)
            throw new IllegalArgumentException("Factor '" + name + "' min > max");
    }

    public static Factor of(String name, double value) {
        return new Factor(name, value, 1.0, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public static Factor of(String name, double value, double step) {
        return new Factor(name, value, step, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    /** Same metadata, different value. */
    public Factor withValue(double newValue) {
        return new Factor(name, newValue, step, min, max);
    }

    /** The value truncated to an int, for periods. */
    public int intValue() {
        return (int) value;
    }

    @Override
    public String toString() {
        return name + "=" + (value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value));
    }
}
