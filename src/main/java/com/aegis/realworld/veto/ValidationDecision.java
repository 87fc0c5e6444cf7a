package com.aegis.realworld.veto;

/** Verdict of the final validator. */
public enum ValidationDecision {
    PASS,
    BLOCK_BUY,
    /** Declared for completeness; no current rule produces it. */
    BLOCK_SELL,
    FORCE_SELL,
    HOLD_ONLY
}
