package com.aegis.optimization;

import com.aegis.config.Config;
import com.aegis.model.PriceBar;
import com.aegis.testing.FakeMarketDataService;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DynamicWeightOptimizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T00:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final Map<MarketVolatility, VolatilitySample> SAMPLES = Map.of(
            MarketVolatility.LOW, new VolatilitySample(10.0, 2.0),
            MarketVolatility.NORMAL, new VolatilitySample(15.0, 4.0),
            MarketVolatility.HIGH, new VolatilitySample(25.0, 6.0),
            MarketVolatility.EXTREME, new VolatilitySample(40.0, 10.0));

    @TempDir
    Path dir;

    private DynamicWeightOptimizer optimizer(FakeMarketDataService market, Map<String, String> extra) {
        Map<String, String> entries = new HashMap<>(extra);
        entries.put("optimizer.weights_file", "state/weights.json");
        return new DynamicWeightOptimizer(market, Config.of(dir, entries), CLOCK);
    }

    @Test
    void adjustedWeightsShouldSumToOneForEveryRegimeAndBucket() {
        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(), Map.of());

        for (Regime regime : Regime.values()) {
            for (Map.Entry<MarketVolatility, VolatilitySample> e : SAMPLES.entrySet()) {
                WeightAdjustment adj = optimizer.getOptimizedWeights(regime.name(), e.getValue());

                assertEquals(e.getKey(), adj.volatility);
                assertEquals(7, adj.adjustedWeights.size());
                double sum = adj.adjustedWeights.values().stream().mapToDouble(Double::doubleValue).sum();
                assertEquals(1.0, sum, 1e-6, regime + "/" + e.getKey());
                assertEquals(e.getKey().confidence(), adj.confidence, 1e-9);
            }
        }
    }

    @Test
    void lowVolatilityShouldFavourTechnicalAndSupply() {
        WeightAdjustment adj = optimizer(new FakeMarketDataService(), Map.of())
                .getOptimizedWeights("bull", SAMPLES.get(MarketVolatility.LOW));

        assertEquals(Regime.BULL, adj.regime);
        assertEquals(0.22 / 1.02, adj.adjustedWeights.get(WeightCategory.TECHNICAL), 1e-9);
        assertTrue(adj.adjustedWeights.get(WeightCategory.FUNDAMENTAL) < adj.originalWeights.get(WeightCategory.FUNDAMENTAL));
        assertTrue(adj.reason.startsWith("낮은 변동성(BULL)"));
    }

    @Test
    void normalVolatilityShouldKeepBaseWeights() {
        WeightAdjustment adj = optimizer(new FakeMarketDataService(), Map.of())
                .getOptimizedWeights("BEAR", SAMPLES.get(MarketVolatility.NORMAL));

        for (WeightCategory c : WeightCategory.values()) {
            assertEquals(adj.originalWeights.get(c), adj.adjustedWeights.get(c), 1e-9);
        }
    }

    @Test
    void unknownRegimeShouldFallBackToSideway() {
        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(), Map.of());

        assertEquals(Regime.SIDEWAY, optimizer.getOptimizedWeights("crab", SAMPLES.get(MarketVolatility.HIGH)).regime);
        assertEquals(Regime.SIDEWAY, optimizer.getOptimizedWeights(null, SAMPLES.get(MarketVolatility.HIGH)).regime);
    }

    @Test
    void measuredVolatilityShouldComeFromIndexHistory() {
        double[] flat = new double[20];
        Arrays.fill(flat, 2500.0);
        FakeMarketDataService calm = new FakeMarketDataService().withCloses("^KS11", flat);
        FakeMarketDataService sparse = new FakeMarketDataService().withCloses("^KS11", 2500.0, 2510.0, 2490.0);

        assertEquals(MarketVolatility.LOW, optimizer(calm, Map.of()).getOptimizedWeights("BULL").volatility);
        assertEquals(MarketVolatility.NORMAL, optimizer(sparse, Map.of()).getOptimizedWeights("BULL").volatility);
        assertEquals(MarketVolatility.NORMAL,
                optimizer(new FakeMarketDataService(), Map.of()).getOptimizedWeights("BULL").volatility);
    }

    @Test
    void volatilityHelpersShouldMeasureReturnsAndRange() {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            double close = i % 2 == 0 ? 100.0 : 102.0;
            bars.add(new PriceBar(Instant.EPOCH.plusSeconds(86_400L * i), close, close + 1, close - 1, close, 0.0));
        }

        assertTrue(DynamicWeightOptimizer.annualizedVolatility(bars) > 30.0);
        // high 103, low 99, mean close of last five (102,100,102,100,102) = 101.2
        assertEquals(4.0 / 101.2 * 100.0, DynamicWeightOptimizer.fiveDayRange(bars), 1e-9);
        assertEquals(0.0, DynamicWeightOptimizer.annualizedVolatility(bars.subList(0, 2)), 1e-9);
    }

    @Test
    void performanceStatsShouldSummariseHistory() {
        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(), Map.of());
        assertEquals(0, optimizer.getPerformanceStats().totalTrades);

        optimizer.recordPerformance(Map.of(), "BULL", "BUY", 2.0);
        optimizer.recordPerformance(Map.of(), "BULL", "BUY", -1.0);
        optimizer.recordPerformance(Map.of(), "BEAR", "SELL", -3.0);

        PerformanceStats stats = optimizer.getPerformanceStats();
        assertEquals(3, stats.totalTrades);
        assertEquals(2.0 / 3.0, stats.successRate, 1e-9);
        assertEquals(-0.67, stats.averageReturn, 1e-9);
        assertEquals(2, stats.regimeStats.get(Regime.BULL).count());
        assertEquals(0.5, stats.regimeStats.get(Regime.BULL).successRate(), 1e-9);
        assertFalse(stats.regimeStats.containsKey(Regime.SIDEWAY));
    }

    @Test
    void historyShouldBeBoundedInMemoryAndOnDisk() throws Exception {
        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(),
                Map.of("optimizer.history_limit", "3", "optimizer.persist_limit", "2"));
        for (int i = 0; i < 5; i++) {
            optimizer.recordPerformance(Map.of(WeightCategory.TECHNICAL, 1.0), "BULL", "BUY", i);
        }
        assertEquals(3, optimizer.getPerformanceHistory().size());
        assertEquals(2.0, optimizer.getPerformanceHistory().get(0).actualReturn(), 1e-9);

        optimizer.saveWeights();
        JSONObject saved = new JSONObject(Files.readString(optimizer.weightsFile(), StandardCharsets.UTF_8));
        assertEquals(2, saved.getJSONArray("performance_history").length());
        assertTrue(saved.has("base_weights"));
        assertTrue(saved.has("updated_at"));
    }

    @Test
    void saveAndLoadShouldRestoreCachedWeightsAndHistory() throws Exception {
        DynamicWeightOptimizer first = optimizer(new FakeMarketDataService(), Map.of());
        WeightAdjustment adj = first.getOptimizedWeights("BEAR", SAMPLES.get(MarketVolatility.EXTREME));
        first.recordPerformance(adj.adjustedWeights, "BEAR", "SELL", -2.5);
        first.saveWeights();

        DynamicWeightOptimizer second = optimizer(new FakeMarketDataService(), Map.of());

        assertEquals(adj.adjustedWeights, second.getCachedWeights().get(Regime.BEAR));
        assertEquals(1, second.getPerformanceHistory().size());
        PerformanceRecord record = second.getPerformanceHistory().get(0);
        assertEquals(MarketVolatility.EXTREME, record.volatility());
        assertTrue(record.success());
        assertEquals(dir.resolve("state/weights.json").normalize(), second.weightsFile());
    }

    @Test
    void corruptWeightsFileShouldBeIgnored() throws Exception {
        Path file = dir.resolve("state/weights.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(), Map.of());

        assertTrue(optimizer.getCachedWeights().isEmpty());
        assertTrue(optimizer.getPerformanceHistory().isEmpty());
    }

    @Test
    void weightsFileWithOneBadRecordShouldLoadNothing() throws Exception {
        Path file = dir.resolve("state/weights.json");
        Files.createDirectories(file.getParent());
        String json = "{\"cached_weights\": {\"BULL\": {\"technical\": 0.5, \"supply\": 0.5}},"
                + " \"performance_history\": ["
                + "{\"timestamp\": \"2026-10-01T00:00:00Z\", \"regime\": \"BULL\", \"volatility\": \"normal\","
                + " \"signal\": \"BUY\", \"actual_return\": 1.0, \"success\": true},"
                + "{\"timestamp\": \"2026-10-02T00:00:00Z\", \"regime\": \"BULL\", \"volatility\": \"wild\","
                + " \"signal\": \"BUY\", \"actual_return\": 2.0, \"success\": true}]}";
        Files.writeString(file, json, StandardCharsets.UTF_8);

        DynamicWeightOptimizer optimizer = optimizer(new FakeMarketDataService(), Map.of());

        assertTrue(optimizer.getCachedWeights().isEmpty());
        assertTrue(optimizer.getPerformanceHistory().isEmpty());
    }
}
