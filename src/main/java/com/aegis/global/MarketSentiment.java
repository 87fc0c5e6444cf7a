package com.aegis.global;

/**
 * Direction of U.S. price action, bucketed on average change percent.
 */
public enum MarketSentiment {
    STRONG_BULLISH("strong_bullish", "강한 상승"),
    BULLISH("bullish", "상승"),
    NEUTRAL("neutral", "중립"),
    BEARISH("bearish", "하락"),
    STRONG_BEARISH("strong_bearish", "강한 하락");

    private final String code;
    private final String label;

    MarketSentiment(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static MarketSentiment fromAverageChange(double avgChangePct) {
        if (avgChangePct >= 2.0) {
            return STRONG_BULLISH;
        }
        if (avgChangePct >= 0.5) {
            return BULLISH;
        }
        if (avgChangePct <= -2.0) {
            return STRONG_BEARISH;
        }
        if (avgChangePct <= -0.5) {
            return BEARISH;
        }
        return NEUTRAL;
    }
}
