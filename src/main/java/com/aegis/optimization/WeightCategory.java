package com.aegis.optimization;

import java.util.Locale;

/** Score categories the fusion step blends. */
public enum WeightCategory {
    TECHNICAL,
    DISCLOSURE,
    SUPPLY,
    FUNDAMENTAL,
    MARKET_CONTEXT,
    NEWS_SENTIMENT,
    CONSENSUS;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WeightCategory fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
