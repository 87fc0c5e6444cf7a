package com.aegis.realworld.execution;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One simulated fill. Amounts are in KRW, percentages in percent. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ExecutionResult {
    public final String ticker;
    public final OrderSide side;
    public final double signalPrice;
    public final double expectedPrice;
    public final double slippage;
    public final double slippagePct;
    public final double taxFee;
    public final double taxFeePct;
    public final int quantity;
    public final double grossAmount;
    /** Gross plus cost for a buy, gross minus cost for a sell. */
    public final double netAmount;
    public final TimeSegment timeSegment;
    public final double weightAdjustment;
    public final Instant simulatedAt;
}
