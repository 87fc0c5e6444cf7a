package com.aegis.realworld.integrity;

import com.aegis.config.Config;
import com.aegis.model.ChartSeries;
import com.aegis.model.PriceBar;
import com.aegis.testing.FakeMarketDataService;
import com.aegis.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataIntegrityManagerTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    // 08:40 KST
    private static final Instant PREMARKET = Instant.parse("2026-10-19T23:40:00Z");

    private static ChartSeries series(String symbol, Instant barTime, double prevClose, double close) {
        PriceBar bar = new PriceBar(barTime, close - 10, close + 5, close - 15, close, 1234.0);
        return new ChartSeries(symbol, List.of(bar), prevClose);
    }

    @Test
    void futuresShouldBeComputedFromPreviousCloseAndCached() {
        MutableClock clock = new MutableClock(PREMARKET, SEOUL);
        FakeMarketDataService market = new FakeMarketDataService()
                .withIntraday("NQ=F", series("NQ=F", PREMARKET.minusSeconds(120), 20_000.0, 20_400.0));
        DataIntegrityManager manager = new DataIntegrityManager(market, Config.defaults(), clock);

        GlobexData nq = manager.getNqFutures().orElseThrow();

        assertEquals("NQ", nq.symbol);
        assertEquals(20_400.0, nq.price);
        assertEquals(400.0, nq.change);
        assertEquals(2.0, nq.changePct);
        assertEquals(1234L, nq.volume);
        assertEquals(DataSource.YAHOO, nq.source);
        assertEquals(DataStatus.FRESH, nq.status);

        manager.getNqFutures();
        assertEquals(1, market.calls("NQ=F"));
        clock.advance(Duration.ofSeconds(61));
        manager.getNqFutures();
        assertEquals(2, market.calls("NQ=F"));
    }

    @Test
    void missingPreviousCloseShouldFallBackToBarOpen() {
        Instant t = Instant.parse("2026-10-19T22:00:00Z");
        PriceBar bar = new PriceBar(t, 100.0, 101.0, 99.0, 99.0, 10.0);
        GlobexData data = DataIntegrityManager.toGlobex("ES", new ChartSeries("ES=F", List.of(bar), null),
                t.plus(Duration.ofMinutes(30)));

        assertEquals(-1.0, data.change);
        assertEquals(-1.0, data.changePct);
        assertEquals(DataStatus.STALE, data.status);
    }

    @Test
    void unknownOrFailingSymbolsShouldBeEmpty() {
        MutableClock clock = new MutableClock(PREMARKET, SEOUL);
        DataIntegrityManager manager = new DataIntegrityManager(new FakeMarketDataService(), Config.defaults(), clock);

        assertEquals(Optional.empty(), manager.getFutures("DAX", false));
        assertEquals(Optional.empty(), manager.getEsFutures());
        assertTrue(manager.getAllFutures().isEmpty());
    }

    @Test
    void premarketSignalShouldFollowNasdaqGap() {
        DataIntegrityManager manager = new DataIntegrityManager(new FakeMarketDataService(), Config.defaults(),
                new MutableClock(PREMARKET, SEOUL));
        GlobexData nq = GlobexData.builder().symbol("NQ").changePct(-0.7).build();

        PremarketSignal signal = manager.getPremarketSignal(nq);

        assertEquals(PremarketGap.GAP_DOWN, signal.signal);
        assertEquals("bearish", signal.bias);
        assertEquals(0.9, signal.weightAdjustment);
        assertEquals(PremarketGap.STRONG_GAP_UP, PremarketGap.of(1.5));
        assertEquals(PremarketGap.FLAT, PremarketGap.of(0.49));
        assertEquals(PremarketGap.STRONG_GAP_DOWN, PremarketGap.of(-1.5));
    }

    @Test
    void healthShouldBeStaleWhenAProbeIsMissing() {
        MutableClock clock = new MutableClock(PREMARKET, SEOUL);
        FakeMarketDataService market = new FakeMarketDataService()
                .withIntraday("NQ=F", series("NQ=F", PREMARKET.minusSeconds(60), 20_000.0, 20_010.0));
        DataIntegrityManager manager = new DataIntegrityManager(market, Config.defaults(), clock);

        DataHealthReport report = manager.checkDataHealth();

        assertEquals(DataStatus.STALE, report.overallStatus);
        assertEquals(Map.of("NQ_futures", DataStatus.FRESH, "ES_futures", DataStatus.UNAVAILABLE), report.sources);
        assertEquals(List.of("ES futures data unavailable"), report.warnings);
        assertTrue(report.latencies.containsKey("NQ_futures"));
        assertFalse(report.latencies.containsKey("ES_futures"));
    }

    @Test
    void healthShouldBeFreshWhenEveryProbeIsFresh() {
        MutableClock clock = new MutableClock(PREMARKET, SEOUL);
        FakeMarketDataService market = new FakeMarketDataService()
                .withIntraday("NQ=F", series("NQ=F", PREMARKET, 20_000.0, 20_010.0))
                .withIntraday("ES=F", series("ES=F", PREMARKET, 6_000.0, 6_003.0));
        DataIntegrityManager manager = new DataIntegrityManager(market, Config.defaults(), clock);

        assertEquals(DataStatus.FRESH, manager.checkDataHealth().overallStatus);
    }

    @Test
    void sessionPredicatesShouldUseSeoulTime() {
        MutableClock clock = new MutableClock(PREMARKET, SEOUL);
        DataIntegrityManager manager = new DataIntegrityManager(new FakeMarketDataService(), Config.defaults(), clock);

        assertTrue(manager.isPremarketTime());
        assertFalse(manager.isMarketOpen());

        clock.advance(Duration.ofMinutes(20)); // 09:00
        assertTrue(manager.isPremarketTime());
        assertTrue(manager.isMarketOpen());

        clock.advance(Duration.ofHours(7)); // 16:00
        assertFalse(manager.isMarketOpen());
        assertTrue(manager.isAfterHours());
    }

    @Test
    void dataStatusShouldClassifyByAge() {
        assertEquals(DataStatus.FRESH, DataStatus.ofAge(Duration.ofMinutes(5)));
        assertEquals(DataStatus.STALE, DataStatus.ofAge(Duration.ofMinutes(6)));
        assertEquals(DataStatus.OUTDATED, DataStatus.ofAge(Duration.ofMinutes(61)));
        assertEquals("unavailable", DataStatus.UNAVAILABLE.code());
    }
}
