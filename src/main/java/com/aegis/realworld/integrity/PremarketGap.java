package com.aegis.realworld.integrity;

import java.util.Locale;

/** Expected opening gap of the Korean market, read off Nasdaq futures. */
public enum PremarketGap {
    STRONG_GAP_UP("bullish", 1.2, "강한 갭상승 예상. 추격매수 주의, 눌림목 대기 권장"),
    GAP_UP("bullish", 1.1, "갭상승 예상. 시초가 매수 검토 가능"),
    FLAT("neutral", 1.0, "보합 출발 예상. 기존 전략 유지"),
    GAP_DOWN("bearish", 0.9, "갭하락 예상. 저가 매수 기회 모색"),
    STRONG_GAP_DOWN("bearish", 0.8, "강한 갭하락 예상. 신규 매수 자제, 손절 라인 점검");

    private final String bias;
    private final double weightAdjustment;
    private final String recommendation;

    PremarketGap(String bias, double weightAdjustment, String recommendation) {
        this.bias = bias;
        this.weightAdjustment = weightAdjustment;
        this.recommendation = recommendation;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String bias() {
        return bias;
    }

    public double weightAdjustment() {
        return weightAdjustment;
    }

    public String recommendation() {
        return recommendation;
    }

    public static PremarketGap of(double nqChangePct) {
        if (nqChangePct >= 1.5) {
            return STRONG_GAP_UP;
        }
        if (nqChangePct >= 0.5) {
            return GAP_UP;
        }
        if (nqChangePct <= -1.5) {
            return STRONG_GAP_DOWN;
        }
        if (nqChangePct <= -0.5) {
            return GAP_DOWN;
        }
        return FLAT;
    }
}
