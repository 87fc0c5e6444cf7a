package com.aegis.realworld.veto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Validator verdict for one stock with the reasons and the adjusted signal. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ValidationResult {
    public final String ticker;
    public final ValidationDecision decision;
    /** In the order the checks fired. */
    public final List<BlockReason> reasons;
    public final Map<String, Object> details;
    public final TradeSignal originalSignal;
    public final double originalScore;
    /** Null for PASS and FORCE_SELL. */
    public final Double adjustedScore;
    /** Null for PASS. */
    public final TradeSignal adjustedSignal;
    public final List<String> warnings;
    public final Instant validatedAt;
}
