package com.aegis.optimization;

import java.util.Map;

/** Runs a real backtest of a strategy mix on one stock over one market period. */
@FunctionalInterface
public interface BacktestFunction {
    BacktestRun run(TestStock stock, Regime period, Map<String, Double> weights);
}
