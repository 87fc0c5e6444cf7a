package com.aegis.optimization;

/**
 * Per-stock, per-period backtest figures. {@code mdd} may be signed; the gate uses its magnitude.
 */
public record BacktestRun(String ticker,
                          String name,
                          String profile,
                          Regime period,
                          double winRate,
                          double mdd,
                          double cagr,
                          double sharpeRatio,
                          double profitFactor,
                          int totalTrades) {

    BacktestRun tagged(TestStock stock, Regime period) {
        return new BacktestRun(stock.ticker(), stock.name(), stock.profile(), period,
                winRate, mdd, cagr, sharpeRatio, profitFactor, totalTrades);
    }
}
