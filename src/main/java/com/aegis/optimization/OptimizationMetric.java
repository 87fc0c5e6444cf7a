package com.aegis.optimization;

/** Metric used to rank backtest results in a grid search. */
public enum OptimizationMetric {
    SHARPE_RATIO,
    PROFIT_FACTOR;

    double valueOf(BacktestMetrics m) {
        return switch (this) {
            case SHARPE_RATIO -> m.sharpeRatio();
            case PROFIT_FACTOR -> m.profitFactor();
        };
    }
}
