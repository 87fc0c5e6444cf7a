package com.aegis.realworld.execution;

import java.util.Locale;

/** Intraday strategy family with its weight per time segment. */
public enum StrategyType {
    VOLATILITY_BREAKOUT,
    TREND_FOLLOWING,
    SUPPLY_DEMAND;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Multiplier for this strategy during the given segment; 1.0 outside the trading day. */
    public double weightIn(TimeSegment segment) {
        return switch (segment) {
            case PREMARKET -> pick(0.8, 0.5, 0.6);
            case OPENING -> pick(1.5, 0.7, 0.8);
            case MORNING -> pick(1.0, 1.2, 1.1);
            case LUNCH -> pick(0.6, 0.8, 0.7);
            case AFTERNOON -> pick(0.8, 1.3, 1.4);
            case CLOSING -> pick(0.5, 1.0, 1.5);
            case AFTER_HOURS, CLOSED -> 1.0;
        };
    }

    private double pick(double breakout, double trend, double supply) {
        return switch (this) {
            case VOLATILITY_BREAKOUT -> breakout;
            case TREND_FOLLOWING -> trend;
            case SUPPLY_DEMAND -> supply;
        };
    }
}
