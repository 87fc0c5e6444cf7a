package com.aegis.context.sentiment;

/** VIX band. */
public enum VixLevel {
    LOW("low"),
    NORMAL("normal"),
    ELEVATED("elevated"),
    HIGH("high"),
    EXTREME("extreme");

    private final String code;

    VixLevel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Readings at or above 100 fall outside every band and are treated as normal. */
    public static VixLevel of(double vix) {
        if (vix >= 0 && vix < 12) {
            return LOW;
        }
        if (vix >= 12 && vix < 20) {
            return NORMAL;
        }
        if (vix >= 20 && vix < 25) {
            return ELEVATED;
        }
        if (vix >= 25 && vix < 35) {
            return HIGH;
        }
        if (vix >= 35 && vix < 100) {
            return EXTREME;
        }
        return NORMAL;
    }
}
