package com.aegis.optimization;

import java.util.Map;

/**
 * Outcome of one backtest run, tagged with the strategy weights it used.
 */
public record BacktestMetrics(Map<String, Double> weights,
                              double sharpeRatio,
                              double profitFactor,
                              double winRate,
                              double totalReturn) {
    public BacktestMetrics {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }
}
