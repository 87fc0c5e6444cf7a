package com.aegis.context.sentiment;

/** RSI band of the market index. */
public enum RsiSignal {
    OVERSOLD("oversold"),
    NEUTRAL("neutral"),
    OVERBOUGHT("overbought");

    private final String code;

    RsiSignal(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RsiSignal of(double rsi) {
        if (rsi < 30) {
            return OVERSOLD;
        }
        if (rsi > 70) {
            return OVERBOUGHT;
        }
        return NEUTRAL;
    }
}
