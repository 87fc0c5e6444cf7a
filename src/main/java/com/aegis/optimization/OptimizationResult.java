package com.aegis.optimization;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Best strategy mix found for a regime, with the metrics of the winning run. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class OptimizationResult {
    public final Regime regime;
    public final Map<String, Double> bestWeights;
    public final double sharpeRatio;
    public final double profitFactor;
    public final double winRate;
    public final double totalReturn;
    /** Number of candidate runs examined; 0 when defaults were returned. */
    public final int iterations;
    public final Instant optimizedAt;
}
