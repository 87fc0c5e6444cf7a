package com.aegis.global;

/**
 * U.S. trading session as seen from the Korean wall clock. Hours only; no holiday calendar.
 */
public enum MarketSession {
    PRE_MARKET,
    REGULAR,
    AFTER_HOURS,
    CLOSED;

    public static MarketSession atHour(int hour) {
        if (hour >= 18 && hour < 22) {
            return PRE_MARKET;
        }
        if (hour >= 22 || hour < 5) {
            return REGULAR;
        }
        if (hour < 7) {
            return AFTER_HOURS;
        }
        return CLOSED;
    }
}
