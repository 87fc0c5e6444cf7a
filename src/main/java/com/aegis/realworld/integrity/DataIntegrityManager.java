package com.aegis.realworld.integrity;

import com.aegis.config.Config;
import com.aegis.core.TtlCacheMap;
import com.aegis.data.MarketDataException;
import com.aegis.data.MarketDataService;
import com.aegis.model.ChartSeries;
import com.aegis.model.PriceBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Watches the freshness of market inputs and reads U.S. index futures before
 * the Korean open.
 *
 * <p>Futures snapshots are cached per symbol for {@code integrity.cache_ttl_sec}
 * seconds. Fetch failures are logged and surface as empty results; session
 * checks use the clock's zone with inclusive bounds.
 */
public class DataIntegrityManager {
    private static final Logger LOG = LogManager.getLogger(DataIntegrityManager.class);

    public static final Map<String, String> GLOBEX_SYMBOLS;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("NQ", "NQ=F");
        m.put("ES", "ES=F");
        m.put("YM", "YM=F");
        m.put("RTY", "RTY=F");
        GLOBEX_SYMBOLS = Collections.unmodifiableMap(m);
    }

    private static final List<String> HEADLINE_FUTURES = List.of("NQ", "ES", "YM");
    private static final List<String> HEALTH_PROBES = List.of("NQ", "ES");

    private static final LocalTime PREMARKET_START = LocalTime.of(8, 30);
    private static final LocalTime MARKET_OPEN = LocalTime.of(9, 0);
    private static final LocalTime MARKET_CLOSE = LocalTime.of(15, 30);
    private static final LocalTime AFTER_HOURS_START = LocalTime.of(15, 40);
    private static final LocalTime AFTER_HOURS_END = LocalTime.of(18, 0);

    private final MarketDataService market;
    private final Clock clock;
    private final TtlCacheMap<String, GlobexData> cache;

    public DataIntegrityManager(MarketDataService market, Config config, Clock clock) {
        this.market = market;
        this.clock = clock;
        this.cache = new TtlCacheMap<>(config.getSeconds("integrity.cache_ttl_sec", 60), clock);
    }

    public Optional<GlobexData> getNqFutures() {
        return getFutures("NQ", false);
    }

    public Optional<GlobexData> getEsFutures() {
        return getFutures("ES", false);
    }

    /** NQ, ES and YM; symbols that fail to load are left out. */
    public Map<String, GlobexData> getAllFutures() {
        Map<String, GlobexData> out = new LinkedHashMap<>();
        for (String name : HEADLINE_FUTURES) {
            getFutures(name, false).ifPresent(d -> out.put(name, d));
        }
        return out;
    }

    public Optional<GlobexData> getFutures(String name, boolean force) {
        String yahooSymbol = GLOBEX_SYMBOLS.get(name);
        if (yahooSymbol == null) {
            LOG.warn("unknown futures symbol {}", name);
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getOrRefresh(name, () -> loadFutures(name, yahooSymbol), force));
    }

    private GlobexData loadFutures(String name, String yahooSymbol) {
        ChartSeries series;
        try {
            series = market.fetchIntraday(yahooSymbol);
        } catch (MarketDataException e) {
            LOG.error("Failed to fetch {} futures: {}", name, e.getMessage());
            return null;
        }
        if (series.isEmpty()) {
            LOG.warn("{} futures: empty intraday series", name);
            return null;
        }
        return toGlobex(name, series, clock.instant());
    }

    static GlobexData toGlobex(String name, ChartSeries series, Instant now) {
        PriceBar latest = series.last();
        double prevClose = series.previousClose != null ? series.previousClose : latest.open;
        double change = latest.close - prevClose;
        double changePct = prevClose != 0.0 ? change / prevClose * 100.0 : 0.0;
        return GlobexData.builder()
                .symbol(name)
                .price(round2(latest.close))
                .change(round2(change))
                .changePct(round2(changePct))
                .volume((long) latest.volume)
                .timestamp(latest.time)
                .source(DataSource.YAHOO)
                .status(DataStatus.ofAge(Duration.between(latest.time, now)))
                .build();
    }

    public PremarketSignal getPremarketSignal(GlobexData nq) {
        PremarketGap gap = PremarketGap.of(nq.changePct);
        return PremarketSignal.builder()
                .signal(gap)
                .bias(gap.bias())
                .nqChangePct(nq.changePct)
                .weightAdjustment(gap.weightAdjustment())
                .recommendation(gap.recommendation())
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Probes NQ and ES futures. Any unavailable probe makes the overall status
     * STALE; the overall status is FRESH only when every probe is fresh.
     */
    public DataHealthReport checkDataHealth() {
        Map<String, DataStatus> sources = new LinkedHashMap<>();
        Map<String, Long> latencies = new LinkedHashMap<>();
        Map<String, Instant> lastUpdate = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        for (String name : HEALTH_PROBES) {
            String key = name + "_futures";
            Instant start = clock.instant();
            Optional<GlobexData> data = getFutures(name, false);
            if (data.isPresent()) {
                sources.put(key, data.get().status);
                latencies.put(key, Duration.between(start, clock.instant()).toMillis());
                lastUpdate.put(key, data.get().timestamp);
            } else {
                sources.put(key, DataStatus.UNAVAILABLE);
                warnings.add(name + " futures data unavailable");
            }
        }

        DataStatus overall;
        if (sources.values().stream().allMatch(s -> s == DataStatus.FRESH)) {
            overall = DataStatus.FRESH;
        } else {
            overall = DataStatus.STALE;
        }
        if (overall != DataStatus.FRESH) {
            LOG.warn("data health {}: {}", overall, sources);
        }
        return DataHealthReport.builder()
                .overallStatus(overall)
                .sources(Collections.unmodifiableMap(sources))
                .latencies(Collections.unmodifiableMap(latencies))
                .lastUpdate(Collections.unmodifiableMap(lastUpdate))
                .warnings(List.copyOf(warnings))
                .generatedAt(clock.instant())
                .build();
    }

    public boolean isPremarketTime() {
        return within(PREMARKET_START, MARKET_OPEN);
    }

    public boolean isMarketOpen() {
        return within(MARKET_OPEN, MARKET_CLOSE);
    }

    public boolean isAfterHours() {
        return within(AFTER_HOURS_START, AFTER_HOURS_END);
    }

    public void clearCache() {
        cache.clear();
    }

    private boolean within(LocalTime from, LocalTime to) {
        LocalTime now = LocalTime.now(clock);
        return !now.isBefore(from) && !now.isAfter(to);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
