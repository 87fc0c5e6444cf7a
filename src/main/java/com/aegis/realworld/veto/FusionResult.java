package com.aegis.realworld.veto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Fused score for one stock, produced upstream. Recognised {@code details}
 * keys: {@code calendar_risk_level}, {@code calendar_warning},
 * {@code market_condition}, {@code fear_greed_score}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FusionResult {
    public final TradeSignal signal;
    public final double finalScore;
    public final boolean tradingHalt;
    public final String haltReason;
    public final double fundamentalScore;
    public final double marketContextScore;
    public final Map<String, Object> details;

    public Object detail(String key, Object fallback) {
        if (details == null) {
            return fallback;
        }
        Object v = details.get(key);
        return v == null ? fallback : v;
    }
}
