package com.aegis.realworld.veto;

import java.util.Locale;

/** Action proposed by the fused score, or forced by the validator. */
public enum TradeSignal {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL,
    FORCE_SELL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBuy() {
        return this == STRONG_BUY || this == BUY;
    }
}
