package com.aegis.optimization;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Category weights for a regime after volatility scaling; adjusted weights sum to 1. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WeightAdjustment {
    public final Regime regime;
    public final MarketVolatility volatility;
    public final Map<WeightCategory, Double> originalWeights;
    /** Sums to 1.0. */
    public final Map<WeightCategory, Double> adjustedWeights;
    public final String reason;
    public final double confidence;
    public final Instant timestamp;
}
