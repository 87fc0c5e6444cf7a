package com.aegis.optimization;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grid search over strategy mixes. Offline tool: it ranks backtest results
 * supplied by the caller and remembers the best mix per regime.
 */
public class WeightOptimizer {
    private static final Logger LOG = LogManager.getLogger(WeightOptimizer.class);

    public static final List<String> DEFAULT_STRATEGIES = List.of("swing", "mean_reversion", "trend_following");

    private final List<String> strategies;
    private final Clock clock;
    private final Map<Regime, Map<String, Double>> optimalWeights = new EnumMap<>(Regime.class);

    public WeightOptimizer(Clock clock) {
        this(DEFAULT_STRATEGIES, clock);
    }

    public WeightOptimizer(List<String> strategies, Clock clock) {
        this.strategies = strategies == null || strategies.isEmpty() ? DEFAULT_STRATEGIES : List.copyOf(strategies);
        this.clock = clock;
    }

    public List<String> strategies() {
        return strategies;
    }

    public List<Map<String, Double>> generateWeightCombinations() {
        return generateWeightCombinations(strategies, 0.1);
    }

    /**
     * Every tuple on the step grid whose weights sum to 1 within 0.01.
     *
     * @param step grid spacing in (0, 1]
     */
    public List<Map<String, Double>> generateWeightCombinations(List<String> names, double step) {
        if (!(step > 0.0 && step <= 1.0)) {
            throw new IllegalArgumentException("step must be in (0, 1]: " + step);
        }
        List<String> keys = names == null || names.isEmpty() ? strategies : names;
        List<Double> grid = new ArrayList<>();
        for (int k = 0; k * step < 1.0 + step - 1e-9; k++) {
            grid.add(Math.round(k * step * 100.0) / 100.0);
        }

        List<Map<String, Double>> out = new ArrayList<>();
        double[] current = new double[keys.size()];
        enumerate(keys, grid, current, 0, out);
        LOG.info("generated {} weight combinations for {} strategies", out.size(), keys.size());
        return out;
    }

    private static void enumerate(List<String> keys, List<Double> grid, double[] current, int pos,
                                  List<Map<String, Double>> out) {
        if (pos == keys.size()) {
            double sum = 0.0;
            for (double v : current) {
                sum += v;
            }
            if (Math.abs(sum - 1.0) < 0.01) {
                Map<String, Double> combo = new LinkedHashMap<>();
                for (int i = 0; i < keys.size(); i++) {
                    combo.put(keys.get(i), current[i]);
                }
                out.add(Collections.unmodifiableMap(combo));
            }
            return;
        }
        for (double v : grid) {
            current[pos] = v;
            enumerate(keys, grid, current, pos + 1, out);
        }
    }

    public OptimizationResult optimizeForRegime(Regime regime, List<BacktestMetrics> results) {
        return optimizeForRegime(regime, results, OptimizationMetric.SHARPE_RATIO);
    }

    public synchronized OptimizationResult optimizeForRegime(Regime regime, List<BacktestMetrics> results,
                                                             OptimizationMetric metric) {
        if (results == null || results.isEmpty()) {
            LOG.warn("no backtest results for {}", regime);
            return emptyResult(regime);
        }
        BacktestMetrics best = null;
        for (BacktestMetrics m : results) {
            if (best == null || metric.valueOf(m) > metric.valueOf(best)) {
                best = m;
            }
        }
        optimalWeights.put(regime, best.weights());
        return OptimizationResult.builder()
                .regime(regime)
                .bestWeights(best.weights())
                .sharpeRatio(best.sharpeRatio())
                .profitFactor(best.profitFactor())
                .winRate(best.winRate())
                .totalReturn(best.totalReturn())
                .iterations(results.size())
                .optimizedAt(clock.instant())
                .build();
    }

    public synchronized Map<String, Double> getOptimalWeights(Regime regime) {
        Map<String, Double> found = optimalWeights.get(regime);
        return found != null ? found : defaultWeights(regime);
    }

    public synchronized Map<Regime, Map<String, Double>> getAllOptimalWeights() {
        Map<Regime, Map<String, Double>> out = new EnumMap<>(Regime.class);
        for (Regime regime : Regime.values()) {
            out.put(regime, getOptimalWeights(regime));
        }
        return out;
    }

    /** Stores the weights, rescaled to sum to 1 when they are off by more than 0.01. */
    public synchronized void setOptimalWeights(Regime regime, Map<String, Double> weights) {
        double total = 0.0;
        for (double v : weights.values()) {
            total += v;
        }
        Map<String, Double> stored = new LinkedHashMap<>(weights);
        if (Math.abs(total - 1.0) > 0.01 && total > 0.0) {
            LOG.warn("weights for {} sum to {}, normalizing", regime, total);
            for (Map.Entry<String, Double> e : stored.entrySet()) {
                e.setValue(e.getValue() / total);
            }
        }
        optimalWeights.put(regime, Collections.unmodifiableMap(stored));
        LOG.info("optimal weights for {}: {}", regime, stored);
    }

    public synchronized void saveWeights(Path file) throws IOException {
        JSONObject root = new JSONObject();
        for (Map.Entry<Regime, Map<String, Double>> e : optimalWeights.entrySet()) {
            root.put(e.getKey().name(), new JSONObject(e.getValue()));
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, root.toString(2), StandardCharsets.UTF_8);
        LOG.info("strategy weights saved to {}", file);
    }

    public synchronized void loadWeights(Path file) throws IOException {
        try {
            JSONObject root = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            for (String key : root.keySet()) {
                JSONObject w = root.getJSONObject(key);
                Map<String, Double> weights = new LinkedHashMap<>();
                for (String strategy : w.keySet()) {
                    weights.put(strategy, w.getDouble(strategy));
                }
                optimalWeights.put(Regime.parse(key), Collections.unmodifiableMap(weights));
            }
        } catch (JSONException e) {
            throw new IOException("malformed weight file " + file, e);
        }
        LOG.info("strategy weights loaded from {}", file);
    }

    static Map<String, Double> defaultWeights(Regime regime) {
        Map<String, Double> w = new LinkedHashMap<>();
        switch (regime) {
            case BULL -> {
                w.put("swing", 0.3);
                w.put("mean_reversion", 0.2);
                w.put("trend_following", 0.5);
            }
            case SIDEWAY -> {
                w.put("swing", 0.3);
                w.put("mean_reversion", 0.6);
                w.put("trend_following", 0.1);
            }
            case BEAR -> {
                w.put("swing", 0.2);
                w.put("mean_reversion", 0.5);
                w.put("trend_following", 0.3);
            }
        }
        return Collections.unmodifiableMap(w);
    }

    private OptimizationResult emptyResult(Regime regime) {
        return new OptimizationResult(regime, defaultWeights(regime), 0.0, 0.0, 0.0, 0.0, 0, clock.instant());
    }
}
