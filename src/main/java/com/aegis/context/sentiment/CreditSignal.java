package com.aegis.context.sentiment;

/** Margin-credit balance bands, in percent of market cap. */
public enum CreditSignal {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    WARNING("warning");

    private final String code;

    CreditSignal(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CreditSignal of(double ratio) {
        if (ratio < 2) {
            return LOW;
        }
        if (ratio < 4) {
            return NORMAL;
        }
        if (ratio < 6) {
            return HIGH;
        }
        return WARNING;
    }

    boolean isElevated() {
        return this == HIGH || this == WARNING;
    }
}
