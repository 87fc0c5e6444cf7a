package com.aegis.context.sector;

/** Expected price impact of a sector event. */
public enum SectorImpact {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int weight;

    SectorImpact(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
