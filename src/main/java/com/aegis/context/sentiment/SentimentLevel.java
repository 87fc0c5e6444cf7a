package com.aegis.context.sentiment;

/** Fear/greed band of the 0-100 sentiment score. */
public enum SentimentLevel {
    EXTREME_FEAR("extreme_fear"),
    FEAR("fear"),
    NEUTRAL("neutral"),
    GREED("greed"),
    EXTREME_GREED("extreme_greed");

    private final String code;

    SentimentLevel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static SentimentLevel of(int score) {
        if (score <= 20) {
            return EXTREME_FEAR;
        }
        if (score <= 40) {
            return FEAR;
        }
        if (score <= 60) {
            return NEUTRAL;
        }
        if (score <= 80) {
            return GREED;
        }
        return EXTREME_GREED;
    }
}
