package com.aegis.global;

import com.aegis.config.Config;
import com.aegis.core.TtlCache;
import com.aegis.data.MarketDataException;
import com.aegis.data.MarketDataService;
import com.aegis.model.PriceBar;
import com.aegis.model.Quote;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects U.S. market quotes used for overnight coupling.
 *
 * <p>The four symbol groups are fetched in parallel on a small fixed pool and
 * the combined snapshot is cached for five minutes.
 */
public class GlobalMarketFetcher implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(GlobalMarketFetcher.class);

    public static final Map<String, String> INDICES = orderedMap(
            "^IXIC", "Nasdaq Composite",
            "^NDX", "Nasdaq 100",
            "^SOX", "PHLX Semiconductor",
            "^GSPC", "S&P 500",
            "^DJI", "Dow Jones",
            "^VIX", "CBOE VIX");

    public static final Map<String, String> KEY_STOCKS = orderedMap(
            "NVDA", "NVIDIA",
            "MU", "Micron",
            "AMD", "AMD",
            "INTC", "Intel",
            "ASML", "ASML",
            "TSLA", "Tesla",
            "RIVN", "Rivian",
            "ALB", "Albemarle",
            "META", "Meta",
            "GOOGL", "Alphabet",
            "AAPL", "Apple",
            "FSLR", "First Solar",
            "ENPH", "Enphase",
            "NEE", "NextEra Energy");

    public static final Map<String, String> FUTURES = orderedMap(
            "NQ=F", "Nasdaq 100 futures",
            "ES=F", "S&P 500 futures");

    public static final String USD_KRW = "KRW=X";

    static final List<String> HEADLINE_INDICES = List.of("^IXIC", "^NDX", "^GSPC");

    static final Map<String, List<String>> SECTOR_BASKETS = Map.of(
            "semiconductor", List.of("NVDA", "MU", "AMD", "INTC", "ASML"),
            "ev_battery", List.of("TSLA", "RIVN", "ALB"),
            "tech", List.of("META", "GOOGL", "AAPL"),
            "energy", List.of("FSLR", "ENPH", "NEE"));

    private final MarketDataService market;
    private final Clock clock;
    private final TtlCache<GlobalMarketData> cache;
    private final ExecutorService executor;

    public GlobalMarketFetcher(MarketDataService market, Config config, Clock clock) {
        this.market = market;
        this.clock = clock;
        this.cache = new TtlCache<>(config.getSeconds("global.cache_ttl_sec", 300), clock);
        this.executor = Executors.newFixedThreadPool(
                Math.max(1, config.getInt("global.pool_size", 4)), daemonThreads());
    }

    public GlobalMarketData fetch() {
        return fetch(false);
    }

    public GlobalMarketData fetch(boolean forceRefresh) {
        return cache.getOrRefresh(this::load, forceRefresh);
    }

    public void clearCache() {
        cache.clear();
        LOG.info("global market cache cleared");
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private GlobalMarketData load() {
        LOG.info("fetching global market data");
        CompletableFuture<Map<String, IndexData>> indices =
                CompletableFuture.supplyAsync(() -> fetchGroup(INDICES), executor);
        CompletableFuture<Map<String, IndexData>> stocks =
                CompletableFuture.supplyAsync(() -> fetchGroup(KEY_STOCKS), executor);
        CompletableFuture<Map<String, IndexData>> futures =
                CompletableFuture.supplyAsync(() -> fetchGroup(FUTURES), executor);
        CompletableFuture<IndexData> forex =
                CompletableFuture.supplyAsync(() -> fetchOne(USD_KRW, "USD/KRW"), executor);

        CompletableFuture.allOf(indices, stocks, futures, forex).join();

        Map<String, IndexData> indexMap = indices.join();
        Map<String, IndexData> stockMap = stocks.join();
        IndexData usdKrw = forex.join();

        GlobalMarketData data = GlobalMarketData.builder()
                .indices(indexMap)
                .stocks(stockMap)
                .futures(futures.join())
                .usdKrw(usdKrw == null ? 0.0 : usdKrw.price)
                .usdKrwChangePct(usdKrw == null ? 0.0 : usdKrw.changePct)
                .overallSentiment(overallSentiment(indexMap))
                .sectorSentiments(sectorSentiments(stockMap))
                .marketSession(MarketSession.atHour(LocalTime.now(clock).getHour()))
                .fetchedAt(clock.instant())
                .build();
        LOG.info("global market data: {} indices, {} stocks, sentiment={}",
                indexMap.size(), stockMap.size(), data.overallSentiment.code());
        return data;
    }

    private Map<String, IndexData> fetchGroup(Map<String, String> symbols) {
        Map<String, IndexData> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : symbols.entrySet()) {
            IndexData data = fetchOne(e.getKey(), e.getValue());
            if (data != null) {
                out.put(e.getKey(), data);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private IndexData fetchOne(String symbol, String name) {
        try {
            List<PriceBar> bars = market.fetchDailyBars(symbol, "5d");
            if (bars == null || bars.isEmpty()) {
                LOG.warn("no bars for {}", symbol);
                return null;
            }
            Quote quote = MarketDataService.lastTwoFromHistory(symbol, bars);
            PriceBar last = bars.get(bars.size() - 1);
            return new IndexData(symbol, name, quote.price, quote.change, quote.changePct,
                    (long) last.volume, clock.instant());
        } catch (MarketDataException e) {
            LOG.warn("failed to fetch {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    static MarketSentiment overallSentiment(Map<String, IndexData> indices) {
        List<Double> changes = new ArrayList<>();
        for (String symbol : HEADLINE_INDICES) {
            IndexData data = indices.get(symbol);
            if (data != null) {
                changes.add(data.changePct);
            }
        }
        return changes.isEmpty() ? MarketSentiment.NEUTRAL : MarketSentiment.fromAverageChange(average(changes));
    }

    static Map<String, MarketSentiment> sectorSentiments(Map<String, IndexData> stocks) {
        Map<String, MarketSentiment> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> sector : SECTOR_BASKETS.entrySet()) {
            List<Double> changes = new ArrayList<>();
            for (String symbol : sector.getValue()) {
                IndexData data = stocks.get(symbol);
                if (data != null) {
                    changes.add(data.changePct);
                }
            }
            out.put(sector.getKey(), changes.isEmpty()
                    ? MarketSentiment.NEUTRAL
                    : MarketSentiment.fromAverageChange(average(changes)));
        }
        return Collections.unmodifiableMap(out);
    }

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }


    private static Map<String, String> orderedMap(String... kv) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            out.put(kv[i], kv[i + 1]);
        }
        return Collections.unmodifiableMap(out);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "global-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
