package com.aegis.optimization;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Volatility bucket with its per-category weight multipliers and the
 * confidence attached to weights chosen under it.
 */
public enum MarketVolatility {
    LOW(0.9, Map.of(
            WeightCategory.TECHNICAL, 1.1,
            WeightCategory.SUPPLY, 1.1,
            WeightCategory.FUNDAMENTAL, 0.9,
            WeightCategory.NEWS_SENTIMENT, 0.9)),
    NORMAL(0.85, Map.of()),
    HIGH(0.7, Map.of(
            WeightCategory.TECHNICAL, 0.8,
            WeightCategory.SUPPLY, 0.9,
            WeightCategory.FUNDAMENTAL, 1.2,
            WeightCategory.NEWS_SENTIMENT, 1.1)),
    EXTREME(0.5, Map.of(
            WeightCategory.TECHNICAL, 0.6,
            WeightCategory.SUPPLY, 0.7,
            WeightCategory.FUNDAMENTAL, 1.4,
            WeightCategory.DISCLOSURE, 1.3,
            WeightCategory.NEWS_SENTIMENT, 1.2));

    private final double confidence;
    private final Map<WeightCategory, Double> multipliers;

    MarketVolatility(double confidence, Map<WeightCategory, Double> multipliers) {
        this.confidence = confidence;
        this.multipliers = multipliers.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(multipliers));
    }

    public double confidence() {
        return confidence;
    }

    public double multiplier(WeightCategory category) {
        return multipliers.getOrDefault(category, 1.0);
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param annualizedVolPct annualized volatility in percent
     * @param rangePct         five-day high/low range as percent of mean close
     */
    public static MarketVolatility classify(double annualizedVolPct, double rangePct) {
        if (annualizedVolPct < 12 && rangePct < 3) {
            return LOW;
        }
        if (annualizedVolPct < 20 && rangePct < 5) {
            return NORMAL;
        }
        if (annualizedVolPct < 30 && rangePct < 8) {
            return HIGH;
        }
        return EXTREME;
    }
}
