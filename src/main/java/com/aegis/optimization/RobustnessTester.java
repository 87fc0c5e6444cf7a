package com.aegis.optimization;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Checks a strategy mix across a panel of stocks and all three market
 * periods. Any run whose drawdown exceeds {@link #MAX_MDD_THRESHOLD} fails
 * the whole test.
 */
public class RobustnessTester {
    private static final Logger LOG = LogManager.getLogger(RobustnessTester.class);

    public static final double MAX_MDD_THRESHOLD = 10.0;

    public static final List<TestStock> DEFAULT_TEST_STOCKS = List.of(
            new TestStock("015760", "KEPCO", "stable"),
            new TestStock("005930", "Samsung", "large_cap"),
            new TestStock("035720", "Kakao", "volatile"),
            new TestStock("000660", "SK Hynix", "cyclical"),
            new TestStock("051910", "LG Chem", "growth"));

    private static final Map<String, double[]> PROFILE_BASE = Map.of(
            "stable", new double[]{55, 5, 8},
            "large_cap", new double[]{52, 8, 12},
            "volatile", new double[]{48, 15, 18},
            "cyclical", new double[]{50, 12, 15},
            "growth", new double[]{51, 10, 14});
    private static final double[] DEFAULT_BASE = {50, 10, 10};

    private final Clock clock;
    private final Random random;

    public RobustnessTester(Clock clock) {
        this(clock, new Random());
    }

    public RobustnessTester(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * @param backtest real backtest hook; when null each run is simulated from the stock's profile
     * @param stocks   panel to test; null or empty uses {@link #DEFAULT_TEST_STOCKS}
     */
    public RobustnessResult runRobustnessTest(Map<String, Double> weights, BacktestFunction backtest,
                                              List<TestStock> stocks) {
        List<TestStock> panel = stocks == null || stocks.isEmpty() ? DEFAULT_TEST_STOCKS : stocks;
        List<BacktestRun> runs = new ArrayList<>();
        boolean passed = true;
        String failReason = null;
        double maxMdd = 0.0;
        double winSum = 0.0;
        double mddSum = 0.0;
        double cagrSum = 0.0;

        for (TestStock stock : panel) {
            for (Regime period : Regime.values()) {
                LOG.info("robustness run {} ({}) in {}", stock.name(), stock.ticker(), period);
                BacktestRun run = backtest != null
                        ? backtest.run(stock, period, weights)
                        : simulate(stock, weights);
                run = run.tagged(stock, period);
                runs.add(run);

                double mdd = Math.abs(run.mdd());
                maxMdd = Math.max(maxMdd, mdd);
                winSum += run.winRate();
                mddSum += mdd;
                cagrSum += run.cagr();
                if (mdd > MAX_MDD_THRESHOLD) {
                    passed = false;
                    failReason = String.format(Locale.US, "%s(%s) %s MDD %.1f%% > %.1f%%",
                            stock.name(), stock.ticker(), period, mdd, MAX_MDD_THRESHOLD);
                    LOG.warn("FAIL: {}", failReason);
                }
            }
        }

        int n = runs.size();
        return RobustnessResult.builder()
                .passed(passed)
                .failReason(failReason)
                .stocksTested(panel.size())
                .periodsTested(Regime.values().length)
                .avgWinRate(n == 0 ? 0.0 : round2(winSum / n))
                .avgMdd(n == 0 ? 0.0 : round2(mddSum / n))
                .maxMdd(round2(maxMdd))
                .avgCagr(n == 0 ? 0.0 : round2(cagrSum / n))
                .individualResults(List.copyOf(runs))
                .testedAt(clock.instant())
                .build();
    }

    BacktestRun simulate(TestStock stock, Map<String, Double> weights) {
        double[] base = PROFILE_BASE.getOrDefault(stock.profile(), DEFAULT_BASE);
        double swing = weights.getOrDefault("swing", 0.3);
        double meanReversion = weights.getOrDefault("mean_reversion", 0.3);
        double winAdj;
        if ("volatile".equals(stock.profile())) {
            winAdj = swing * 5 - meanReversion * 3;
        } else if ("stable".equals(stock.profile())) {
            winAdj = meanReversion * 5 - swing * 2;
        } else {
            winAdj = 0.0;
        }
        return new BacktestRun(stock.ticker(), stock.name(), stock.profile(), null,
                base[0] + winAdj + uniform(3),
                base[1] + uniform(2),
                base[2] + uniform(3),
                0.8 + uniform(0.3),
                1.2 + uniform(0.2),
                (int) (50 + uniform(10)));
    }

    private double uniform(double halfWidth) {
        return (random.nextDouble() * 2.0 - 1.0) * halfWidth;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
