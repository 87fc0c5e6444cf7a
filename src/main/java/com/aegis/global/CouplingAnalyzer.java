package com.aegis.global;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores how last night's U.S. session should tilt a Korean stock.
 *
 * <p>A stock resolves to an explicit mapping by code, else to its sector's
 * default mapping. The score blends the related U.S. stocks and indices by the
 * mapping's strength and becomes a multiplicative adjustment factor. Quotes come
 * from one {@link GlobalMarketFetcher} snapshot, so a batch sees a single view.
 */
public class CouplingAnalyzer {
    private static final Logger LOG = LogManager.getLogger(CouplingAnalyzer.class);

    private static final Map<String, SectorDefault> SECTOR_DEFAULTS = Map.of(
            "semiconductor", new SectorDefault(List.of("NVDA", "AMD"), List.of("^SOX", "^NDX"), CouplingStrength.MODERATE),
            "ev_battery", new SectorDefault(List.of("TSLA"), List.of("^NDX"), CouplingStrength.WEAK),
            "tech", new SectorDefault(List.of("META", "GOOGL"), List.of("^NDX", "^IXIC"), CouplingStrength.WEAK),
            "energy", new SectorDefault(List.of("FSLR"), List.of("^GSPC"), CouplingStrength.WEAK),
            "financial", new SectorDefault(List.of(), List.of("^GSPC"), CouplingStrength.WEAK),
            "default", new SectorDefault(List.of(), List.of("^GSPC", "^IXIC"), CouplingStrength.WEAK));

    private record SectorDefault(List<String> usSymbols, List<String> usIndices, CouplingStrength strength) {
    }

    private final GlobalMarketFetcher fetcher;
    private final Clock clock;
    private final Map<String, CouplingMapping> mappings = new ConcurrentHashMap<>();

    public CouplingAnalyzer(GlobalMarketFetcher fetcher, Clock clock) {
        this.fetcher = fetcher;
        this.clock = clock;
        for (CouplingMapping m : builtInMappings()) {
            mappings.put(m.krStockCode(), m);
        }
    }

    public CouplingResult analyze(String stockCode, String stockName, String sector) {
        return analyze(stockCode, stockName, sector, fetcher.fetch());
    }

    /** Analyzes every input against a single snapshot; inputs that fail are logged and left out. */
    public Map<String, CouplingResult> analyzeBatch(List<StockRef> stocks) {
        GlobalMarketData snapshot = fetcher.fetch();
        Map<String, CouplingResult> results = new LinkedHashMap<>();
        for (StockRef ref : stocks) {
            try {
                results.put(ref.code(), analyze(ref.code(), ref.name(), ref.sector(), snapshot));
            } catch (RuntimeException e) {
                LOG.warn("coupling analysis failed for {}: {}", ref.code(), e.toString());
            }
        }
        return results;
    }

    CouplingResult analyze(String stockCode, String stockName, String sector, GlobalMarketData data) {
        Objects.requireNonNull(stockCode, "stockCode");
        CouplingMapping mapping = mappingFor(stockCode, stockName, sector);

        Map<String, IndexData> relatedStocks = pick(data.stocks, mapping.usSymbols());
        Map<String, IndexData> relatedIndices = pick(data.indices, mapping.usIndices());
        MarketSentiment usSentiment = data.overallSentiment == null ? MarketSentiment.NEUTRAL : data.overallSentiment;
        MarketSentiment sectorSentiment = data.sectorSentiments == null
                ? MarketSentiment.NEUTRAL
                : data.sectorSentiments.getOrDefault(mapping.sector(), MarketSentiment.NEUTRAL);

        double score = couplingScore(relatedStocks, relatedIndices, mapping.strength());
        double factor = adjustmentFactor(score, mapping.strength());

        return CouplingResult.builder()
                .stockCode(stockCode)
                .stockName(stockName)
                .strength(mapping.strength())
                .relatedUsStocks(relatedStocks)
                .relatedUsIndices(relatedIndices)
                .usSentiment(usSentiment)
                .sectorSentiment(sectorSentiment)
                .couplingScore(score)
                .adjustmentFactor(factor)
                .analysisReason(reason(mapping, usSentiment, sectorSentiment, score))
                .analyzedAt(clock.instant())
                .build();
    }

    public CouplingMapping mappingFor(String stockCode, String stockName, String sector) {
        CouplingMapping direct = mappings.get(stockCode);
        if (direct != null) {
            return direct;
        }
        String key = sector != null && SECTOR_DEFAULTS.containsKey(sector) ? sector : "default";
        SectorDefault d = SECTOR_DEFAULTS.get(key);
        return new CouplingMapping(stockCode, stockName, d.usSymbols(), d.usIndices(), key, d.strength(),
                key + " 섹터 기본 커플링");
    }

    static double couplingScore(Map<String, IndexData> stocks, Map<String, IndexData> indices, CouplingStrength strength) {
        if (strength == CouplingStrength.NONE) {
            return 0.0;
        }
        double weighted = averageChange(stocks) * strength.stockWeight()
                + averageChange(indices) * strength.indexWeight();
        double score = Math.max(-100.0, Math.min(100.0, weighted * 10.0));
        return Math.round(score * 100.0) / 100.0;
    }

    static double adjustmentFactor(double score, CouplingStrength strength) {
        if (strength == CouplingStrength.NONE) {
            return 1.0;
        }
        double factor = 1.0 + score / 100.0 * strength.maxAdjustment();
        return Math.round(factor * 1000.0) / 1000.0;
    }

    public List<String> getSupportedMappings() {
        List<String> codes = new ArrayList<>(mappings.keySet());
        Collections.sort(codes);
        return codes;
    }

    public void addCustomMapping(CouplingMapping mapping) {
        mappings.put(mapping.krStockCode(), mapping);
        LOG.info("added custom coupling mapping {} ({})", mapping.krStockCode(), mapping.krStockName());
    }

    private static String reason(CouplingMapping mapping, MarketSentiment us, MarketSentiment sector, double score) {
        String direction = score > 0 ? "긍정적" : score < 0 ? "부정적" : "중립";
        return String.format(Locale.US, "[%s] %s | 미국시장 %s, 섹터(%s) %s | 커플링 점수 %+.1f (%s)",
                mapping.strength().code(), mapping.description(), us.label(), mapping.sector(), sector.label(),
                score, direction);
    }

    private static Map<String, IndexData> pick(Map<String, IndexData> source, List<String> symbols) {
        Map<String, IndexData> out = new LinkedHashMap<>();
        if (source == null) {
            return out;
        }
        for (String symbol : symbols) {
            IndexData data = source.get(symbol);
            if (data != null) {
                out.put(symbol, data);
            }
        }
        return out;
    }

    private static double averageChange(Map<String, IndexData> quotes) {
        if (quotes.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (IndexData q : quotes.values()) {
            sum += q.changePct;
        }
        return sum / quotes.size();
    }

    private static List<CouplingMapping> builtInMappings() {
        return List.of(
                new CouplingMapping("005930", "삼성전자", List.of("NVDA", "MU", "AMD", "INTC", "ASML"),
                        List.of("^SOX", "^NDX"), "semiconductor", CouplingStrength.STRONG, "글로벌 반도체 사이클 직접 연동"),
                new CouplingMapping("000660", "SK하이닉스", List.of("NVDA", "MU", "AMD"),
                        List.of("^SOX", "^NDX"), "semiconductor", CouplingStrength.STRONG, "HBM 수혜주, NVIDIA 직접 연관"),
                new CouplingMapping("243840", "금양그린파워", List.of("TSLA", "RIVN", "ALB"),
                        List.of("^NDX"), "ev_battery", CouplingStrength.MODERATE, "2차전지 소재주, Tesla 간접 연관"),
                new CouplingMapping("247540", "에코프로비엠", List.of("TSLA", "ALB"),
                        List.of("^NDX"), "ev_battery", CouplingStrength.MODERATE, "양극재 공급, Tesla 간접 연관"),
                new CouplingMapping("086520", "에코프로", List.of("TSLA", "ALB"),
                        List.of("^NDX"), "ev_battery", CouplingStrength.MODERATE, "2차전지 소재, EV 시장 연관"),
                new CouplingMapping("035720", "카카오", List.of("META", "GOOGL"),
                        List.of("^NDX", "^IXIC"), "tech", CouplingStrength.MODERATE, "플랫폼/광고 사업, 빅테크 심리 연동"),
                new CouplingMapping("035420", "NAVER", List.of("META", "GOOGL", "AAPL"),
                        List.of("^NDX", "^IXIC"), "tech", CouplingStrength.MODERATE, "검색/광고/AI, 빅테크 심리 연동"),
                new CouplingMapping("322000", "HD현대에너지솔루션", List.of("FSLR", "ENPH"),
                        List.of("^GSPC"), "energy", CouplingStrength.MODERATE, "태양광 모듈, 미국 태양광주 연관"),
                new CouplingMapping("015760", "한국전력", List.of("NEE"),
                        List.of("^GSPC"), "energy", CouplingStrength.WEAK, "전력/유틸리티, 간접 연관"),
                new CouplingMapping("316140", "우리금융지주", List.of(),
                        List.of("^GSPC", "^DJI"), "financial", CouplingStrength.WEAK, "국내 금융, 글로벌 금융 심리만 연관"));
    }
}
