package com.aegis.realworld.execution;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/** Simulated round trip: fills, costs and net profit. Amounts are in KRW. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PnLSimulation {
    public final String ticker;
    public final double buyPrice;
    public final double buySlippage;
    public final double buyCost;
    public final double sellPrice;
    public final double sellSlippage;
    public final double sellCost;
    public final double grossProfit;
    public final double totalCost;
    public final double netProfit;
    public final double netProfitPct;
    public final double breakevenPct;
}
