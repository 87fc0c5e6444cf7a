package com.aegis.context.sentiment;

/**
 * Overall market regime with the position multiplier and warning it implies.
 */
public enum MarketCondition {
    EUPHORIA("euphoria", 0.5, "버블 경고 - 신규 매수 금지"),
    OVERHEATED("overheated", 0.7, "시장 과열 - 차익실현 고려"),
    BULLISH("bullish", 1.1, null),
    NEUTRAL("neutral", 1.0, null),
    CAUTIOUS("cautious", 0.8, null),
    FEAR("fear", 0.6, "공포 심리 확산 - 신규 매수 자제"),
    PANIC("panic", 0.3, "패닉 상태 - 현금 비중 확대 권고");

    private final String code;
    private final double positionMultiplier;
    private final String warning;

    MarketCondition(String code, double positionMultiplier, String warning) {
        this.code = code;
        this.positionMultiplier = positionMultiplier;
        this.warning = warning;
    }

    public String code() {
        return code;
    }

    public double positionMultiplier() {
        return positionMultiplier;
    }

    /** Null when the condition carries no warning. */
    public String warning() {
        return warning;
    }
}
