package com.trading.indicator.api;

/** Trend side reported by stop-and-reverse and turning-point formulas. */
public enum Side {
    ENTER_LONG,
    EXIT_LONG
}
