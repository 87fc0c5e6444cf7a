package com.aegis.optimization;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobustnessTesterTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-10-19T00:00:00Z"), ZoneOffset.UTC);
    private final RobustnessTester tester = new RobustnessTester(clock, new Random(42));
    private final Map<String, Double> weights = Map.of("swing", 0.3, "mean_reversion", 0.4, "trend_following", 0.3);

    @Test
    void shallowDrawdownsShouldPass() {
        BacktestFunction backtest = (stock, period, w) ->
                new BacktestRun(null, null, null, null, 55.0, -4.0, 12.0, 1.1, 1.4, 40);

        RobustnessResult result = tester.runRobustnessTest(weights, backtest, null);

        assertTrue(result.passed);
        assertNull(result.failReason);
        assertEquals(5, result.stocksTested);
        assertEquals(3, result.periodsTested);
        assertEquals(15, result.individualResults.size());
        assertEquals(4.0, result.avgMdd, 1e-9);
        assertEquals(4.0, result.maxMdd, 1e-9);
        assertEquals(55.0, result.avgWinRate, 1e-9);
    }

    @Test
    void anyDeepDrawdownShouldFailWholeTest() {
        BacktestFunction backtest = (stock, period, w) -> {
            double mdd = "035720".equals(stock.ticker()) && period == Regime.BEAR ? -12.0 : -3.0;
            return new BacktestRun(null, null, null, null, 50.0, mdd, 8.0, 0.9, 1.2, 30);
        };

        RobustnessResult result = tester.runRobustnessTest(weights, backtest, RobustnessTester.DEFAULT_TEST_STOCKS);

        assertFalse(result.passed);
        assertEquals("Kakao(035720) BEAR MDD 12.0% > 10.0%", result.failReason);
        assertEquals(12.0, result.maxMdd, 1e-9);
    }

    @Test
    void runsShouldBeTaggedWithStockAndPeriod() {
        List<TestStock> panel = List.of(new TestStock("999999", "Custom", "unknown"));

        RobustnessResult result = tester.runRobustnessTest(weights, null, panel);

        assertEquals(3, result.individualResults.size());
        assertEquals(List.of(Regime.BULL, Regime.BEAR, Regime.SIDEWAY),
                result.individualResults.stream().map(BacktestRun::period).toList());
        assertTrue(result.individualResults.stream().allMatch(r -> "999999".equals(r.ticker())));
    }

    @Test
    void simulatedVolatileProfileShouldBreachDrawdownLimit() {
        BacktestRun run = tester.simulate(new TestStock("035720", "Kakao", "volatile"), weights);
        BacktestRun stable = tester.simulate(new TestStock("015760", "KEPCO", "stable"), weights);

        assertTrue(Math.abs(run.mdd()) > RobustnessTester.MAX_MDD_THRESHOLD);
        assertTrue(Math.abs(stable.mdd()) < RobustnessTester.MAX_MDD_THRESHOLD);
        assertFalse(tester.runRobustnessTest(weights, null, null).passed);
    }
}
