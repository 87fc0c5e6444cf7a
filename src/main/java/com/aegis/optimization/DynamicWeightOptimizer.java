package com.aegis.optimization;

import com.aegis.config.Config;
import com.aegis.data.MarketDataException;
import com.aegis.data.MarketDataService;
import com.aegis.model.PriceBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks category weights for a market regime and rescales them by the
 * current volatility bucket.
 *
 * <p>Performance records are kept for reporting and persisted with the last
 * adjusted weights per regime; they do not influence weight selection.
 */
public class DynamicWeightOptimizer {
    private static final Logger LOG = LogManager.getLogger(DynamicWeightOptimizer.class);

    static final Map<Regime, Map<WeightCategory, Double>> BASE_WEIGHTS = buildBaseWeights();

    private final MarketDataService market;
    private final Clock clock;
    private final String indexSymbol;
    private final Path weightsFile;
    private final int historyLimit;
    private final int persistLimit;

    private final Map<Regime, Map<WeightCategory, Double>> cachedWeights = new EnumMap<>(Regime.class);
    private final List<PerformanceRecord> history = new ArrayList<>();
    private MarketVolatility currentVolatility;

    public DynamicWeightOptimizer(MarketDataService market, Config config, Clock clock) {
        this.market = market;
        this.clock = clock;
        this.indexSymbol = config.getString("sentiment.index_symbol", "^KS11");
        this.weightsFile = config.getPath("optimizer.weights_file");
        this.historyLimit = config.getInt("optimizer.history_limit", 100);
        this.persistLimit = config.getInt("optimizer.persist_limit", 50);
        loadWeights();
    }

    public WeightAdjustment getOptimizedWeights(String regime) {
        return getOptimizedWeights(regime, null);
    }

    /**
     * @param sample precomputed volatility; when null the index history is measured
     */
    public synchronized WeightAdjustment getOptimizedWeights(String regime, VolatilitySample sample) {
        Regime r = Regime.parse(regime);
        MarketVolatility volatility = sample != null
                ? MarketVolatility.classify(sample.annualizedVolatilityPct(), sample.fiveDayRangePct())
                : measureVolatility();
        currentVolatility = volatility;

        Map<WeightCategory, Double> base = BASE_WEIGHTS.get(r);
        Map<WeightCategory, Double> adjusted = adjust(base, volatility);
        cachedWeights.put(r, adjusted);

        WeightAdjustment result = WeightAdjustment.builder()
                .regime(r)
                .volatility(volatility)
                .originalWeights(base)
                .adjustedWeights(adjusted)
                .reason(reason(r, volatility))
                .confidence(volatility.confidence())
                .timestamp(clock.instant())
                .build();
        LOG.info("weights for {} under {} volatility: {}", r, volatility.code(), adjusted);
        return result;
    }

    static Map<WeightCategory, Double> adjust(Map<WeightCategory, Double> base, MarketVolatility volatility) {
        Map<WeightCategory, Double> raw = new EnumMap<>(WeightCategory.class);
        double total = 0.0;
        for (Map.Entry<WeightCategory, Double> e : base.entrySet()) {
            double w = e.getValue() * volatility.multiplier(e.getKey());
            raw.put(e.getKey(), w);
            total += w;
        }
        Map<WeightCategory, Double> out = new EnumMap<>(WeightCategory.class);
        for (Map.Entry<WeightCategory, Double> e : raw.entrySet()) {
            out.put(e.getKey(), total > 0 ? e.getValue() / total : 1.0 / raw.size());
        }
        return Collections.unmodifiableMap(out);
    }

    static String reason(Regime regime, MarketVolatility volatility) {
        return switch (volatility) {
            case LOW -> "낮은 변동성(" + regime + ") - 기술적/수급 신호 강화";
            case NORMAL -> "정상 변동성(" + regime + ") - 기본 가중치 유지";
            case HIGH -> "높은 변동성(" + regime + ") - 펀더멘털/뉴스 신호 강화";
            case EXTREME -> "극심한 변동성(" + regime + ") - 방어적 가중치 적용";
        };
    }

    MarketVolatility measureVolatility() {
        try {
            Instant from = clock.instant().minus(Duration.ofDays(30));
            List<PriceBar> bars = new ArrayList<>();
            for (PriceBar bar : market.fetchDailyBars(indexSymbol, "3mo")) {
                if (!bar.time.isBefore(from)) {
                    bars.add(bar);
                }
            }
            if (bars.size() < 10) {
                LOG.warn("only {} bars for {}, assuming normal volatility", bars.size(), indexSymbol);
                return MarketVolatility.NORMAL;
            }
            return MarketVolatility.classify(annualizedVolatility(bars), fiveDayRange(bars));
        } catch (MarketDataException e) {
            LOG.warn("volatility measurement failed, assuming normal: {}", e.getMessage());
            return MarketVolatility.NORMAL;
        }
    }

    static double annualizedVolatility(List<PriceBar> bars) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            double prev = bars.get(i - 1).close;
            if (prev > 0) {
                returns.add(bars.get(i).close / prev - 1.0);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.size();
        double ss = 0.0;
        for (double r : returns) {
            ss += (r - mean) * (r - mean);
        }
        return Math.sqrt(ss / (returns.size() - 1)) * Math.sqrt(252) * 100.0;
    }

    static double fiveDayRange(List<PriceBar> bars) {
        List<PriceBar> last = bars.subList(Math.max(0, bars.size() - 5), bars.size());
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        double closeSum = 0.0;
        for (PriceBar bar : last) {
            high = Math.max(high, bar.high);
            low = Math.min(low, bar.low);
            closeSum += bar.close;
        }
        double meanClose = closeSum / last.size();
        return meanClose > 0 ? (high - low) / meanClose * 100.0 : 0.0;
    }

    public synchronized void recordPerformance(Map<WeightCategory, Double> weightsUsed, String regime,
                                               String signal, double actualReturn) {
        history.add(new PerformanceRecord(
                clock.instant(),
                Regime.parse(regime),
                currentVolatility,
                weightsUsed == null ? Map.of() : Map.copyOf(weightsUsed),
                signal,
                actualReturn,
                PerformanceRecord.isSuccess(signal, actualReturn)));
        while (history.size() > historyLimit) {
            history.remove(0);
        }
        LOG.info("performance recorded: {} -> {}%", signal, actualReturn);
    }

    public synchronized PerformanceStats getPerformanceStats() {
        if (history.isEmpty()) {
            return PerformanceStats.empty();
        }
        int successes = 0;
        double returnSum = 0.0;
        for (PerformanceRecord r : history) {
            successes += r.success() ? 1 : 0;
            returnSum += r.actualReturn();
        }
        Map<Regime, PerformanceStats.RegimeStats> perRegime = new EnumMap<>(Regime.class);
        for (Regime regime : Regime.values()) {
            int count = 0;
            int ok = 0;
            double sum = 0.0;
            for (PerformanceRecord r : history) {
                if (r.regime() == regime) {
                    count++;
                    ok += r.success() ? 1 : 0;
                    sum += r.actualReturn();
                }
            }
            if (count > 0) {
                perRegime.put(regime, new PerformanceStats.RegimeStats(count, (double) ok / count, sum / count));
            }
        }
        int total = history.size();
        return new PerformanceStats(total, (double) successes / total,
                Math.round(returnSum / total * 100.0) / 100.0, Collections.unmodifiableMap(perRegime));
    }

    public synchronized List<PerformanceRecord> getPerformanceHistory() {
        return List.copyOf(history);
    }

    public synchronized Map<Regime, Map<WeightCategory, Double>> getCachedWeights() {
        return Collections.unmodifiableMap(new EnumMap<>(cachedWeights));
    }

    public Path weightsFile() {
        return weightsFile;
    }

    public synchronized void saveWeights() throws IOException {
        JSONObject root = new JSONObject();
        JSONObject base = new JSONObject();
        for (Map.Entry<Regime, Map<WeightCategory, Double>> e : BASE_WEIGHTS.entrySet()) {
            base.put(e.getKey().name(), toJson(e.getValue()));
        }
        JSONObject cached = new JSONObject();
        for (Map.Entry<Regime, Map<WeightCategory, Double>> e : cachedWeights.entrySet()) {
            cached.put(e.getKey().name(), toJson(e.getValue()));
        }
        JSONArray records = new JSONArray();
        for (PerformanceRecord r : history.subList(Math.max(0, history.size() - persistLimit), history.size())) {
            JSONObject o = new JSONObject();
            o.put("timestamp", r.timestamp().toString());
            o.put("regime", r.regime().name());
            o.put("volatility", r.volatility() == null ? "unknown" : r.volatility().code());
            o.put("weights", toJson(r.weights()));
            o.put("signal", r.signal());
            o.put("actual_return", r.actualReturn());
            o.put("success", r.success());
            records.put(o);
        }
        root.put("base_weights", base);
        root.put("cached_weights", cached);
        root.put("performance_history", records);
        root.put("updated_at", clock.instant().toString());

        Path parent = weightsFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(weightsFile, root.toString(2), StandardCharsets.UTF_8);
        LOG.info("weights saved to {}", weightsFile);
    }

    private void loadWeights() {
        if (!Files.exists(weightsFile)) {
            return;
        }
        try {
            JSONObject root = new JSONObject(Files.readString(weightsFile, StandardCharsets.UTF_8));
            Map<Regime, Map<WeightCategory, Double>> loadedWeights = new EnumMap<>(Regime.class);
            JSONObject cached = root.optJSONObject("cached_weights");
            if (cached != null) {
                for (String key : cached.keySet()) {
                    loadedWeights.put(Regime.parse(key), fromJson(cached.getJSONObject(key)));
                }
            }
            List<PerformanceRecord> loadedHistory = new ArrayList<>();
            JSONArray records = root.optJSONArray("performance_history");
            if (records != null) {
                for (int i = 0; i < records.length(); i++) {
                    JSONObject o = records.getJSONObject(i);
                    String vol = o.optString("volatility", "unknown");
                    loadedHistory.add(new PerformanceRecord(
                            Instant.parse(o.getString("timestamp")),
                            Regime.parse(o.optString("regime", null)),
                            "unknown".equals(vol) ? null : MarketVolatility.valueOf(vol.toUpperCase(Locale.ROOT)),
                            fromJson(o.optJSONObject("weights")),
                            o.optString("signal", "HOLD"),
                            o.optDouble("actual_return", 0.0),
                            o.optBoolean("success", true)));
                }
            }
            // applied only once the whole file parsed
            cachedWeights.putAll(loadedWeights);
            history.addAll(loadedHistory);
            LOG.info("weights loaded from {}", weightsFile);
        } catch (IOException | JSONException | DateTimeParseException | IllegalArgumentException e) {
            LOG.warn("failed to load weights from {}: {}", weightsFile, e.getMessage());
        }
    }

    private static JSONObject toJson(Map<WeightCategory, Double> weights) {
        JSONObject o = new JSONObject();
        for (Map.Entry<WeightCategory, Double> e : weights.entrySet()) {
            o.put(e.getKey().key(), e.getValue());
        }
        return o;
    }

    private static Map<WeightCategory, Double> fromJson(JSONObject o) {
        Map<WeightCategory, Double> out = new EnumMap<>(WeightCategory.class);
        if (o != null) {
            for (String key : o.keySet()) {
                out.put(WeightCategory.fromKey(key), o.getDouble(key));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static Map<Regime, Map<WeightCategory, Double>> buildBaseWeights() {
        Map<Regime, Map<WeightCategory, Double>> out = new EnumMap<>(Regime.class);
        out.put(Regime.BULL, weights(0.20, 0.10, 0.25, 0.10, 0.10, 0.15, 0.10));
        out.put(Regime.BEAR, weights(0.15, 0.15, 0.15, 0.20, 0.10, 0.15, 0.10));
        out.put(Regime.SIDEWAY, weights(0.25, 0.10, 0.20, 0.10, 0.10, 0.15, 0.10));
        return Collections.unmodifiableMap(out);
    }

    /** Values in {@link WeightCategory} declaration order. */
    private static Map<WeightCategory, Double> weights(double... values) {
        Map<WeightCategory, Double> out = new EnumMap<>(WeightCategory.class);
        WeightCategory[] categories = WeightCategory.values();
        for (int i = 0; i < categories.length; i++) {
            out.put(categories[i], values[i]);
        }
        return Collections.unmodifiableMap(out);
    }
}
