package com.aegis.global;

/**
 * How tightly a Korean stock tracks its U.S. peers. Each level fixes the
 * stock/index blend and the maximum weight adjustment.
 */
public enum CouplingStrength {
    STRONG("strong", 0.7, 0.2),
    MODERATE("moderate", 0.5, 0.15),
    WEAK("weak", 0.3, 0.1),
    NONE("none", 0.0, 0.0);

    private final String code;
    private final double stockWeight;
    private final double maxAdjustment;

    CouplingStrength(String code, double stockWeight, double maxAdjustment) {
        this.code = code;
        this.stockWeight = stockWeight;
        this.maxAdjustment = maxAdjustment;
    }

    public String code() {
        return code;
    }

    public double stockWeight() {
        return stockWeight;
    }

    public double indexWeight() {
        return this == NONE ? 0.0 : 1.0 - stockWeight;
    }

    public double maxAdjustment() {
        return maxAdjustment;
    }
}
