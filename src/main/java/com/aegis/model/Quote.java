package com.aegis.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Latest price with its one-session change, rounded to two decimals.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Quote {
    public final String symbol;
    public final double price;
    public final double change;
    public final double changePct;

    /** Builds a quote from the last two closes; {@code prev} must be positive. */
    public static Quote fromCloses(String symbol, double last, double prev) {
        double change = last - prev;
        double pct = change / prev * 100.0;
        return new Quote(symbol, round2(last), round2(change), round2(pct));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
