package com.aegis.optimization;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/** Aggregated success rate and return of the recorded performance history. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class PerformanceStats {
    public final int totalTrades;
    public final double successRate;
    public final double averageReturn;
    public final Map<Regime, RegimeStats> regimeStats;

    public record RegimeStats(int count, double successRate, double averageReturn) {
    }

    public static PerformanceStats empty() {
        return new PerformanceStats(0, 0.0, 0.0, Map.of());
    }
}
