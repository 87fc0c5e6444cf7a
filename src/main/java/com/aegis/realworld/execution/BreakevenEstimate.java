package com.aegis.realworld.execution;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/** Components of the price rise needed to cover one round trip. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class BreakevenEstimate {
    public final double price;
    public final int tickSize;
    public final double buySlippagePct;
    public final double sellSlippagePct;
    public final double buyCostPct;
    public final double sellCostPct;
    public final double totalBreakevenPct;
    public final String note;
}
