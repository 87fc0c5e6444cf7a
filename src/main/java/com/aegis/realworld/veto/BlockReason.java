package com.aegis.realworld.veto;

/**
 * Why a signal was vetoed. Hard reasons block new buys outright; soft reasons
 * only stop buy signals.
 */
public enum BlockReason {
    FUNDAMENTAL_RISK(true),
    MARKET_PANIC(false),
    LIQUIDITY_TRAP(true),
    DISCLOSURE_HALT(true),
    CALENDAR_CRITICAL(false),
    /** Raised for a panic or fear market condition from the sentiment meter. */
    OVERHEATED_MARKET(false),
    HIGH_VOLATILITY(false);

    private final boolean hard;

    BlockReason(boolean hard) {
        this.hard = hard;
    }

    public boolean isHard() {
        return hard;
    }
}
