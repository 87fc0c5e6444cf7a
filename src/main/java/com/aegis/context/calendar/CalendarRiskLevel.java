package com.aegis.context.calendar;

import java.util.Locale;

/**
 * Calendar risk band with the position adjustment it implies.
 */
public enum CalendarRiskLevel {
    LOW(1.0, false),
    MEDIUM(0.9, false),
    HIGH(0.7, true),
    CRITICAL(0.5, true);

    private final double positionAdjustment;
    private final boolean reduceExposure;

    CalendarRiskLevel(double positionAdjustment, boolean reduceExposure) {
        this.positionAdjustment = positionAdjustment;
        this.reduceExposure = reduceExposure;
    }

    /** Lower-case literal used in fusion details, e.g. {@code "critical"}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public double positionAdjustment() {
        return positionAdjustment;
    }

    public boolean reduceExposure() {
        return reduceExposure;
    }

    public static CalendarRiskLevel ofScore(double score) {
        if (score >= 0.7) {
            return CRITICAL;
        }
        if (score >= 0.4) {
            return HIGH;
        }
        if (score >= 0.2) {
            return MEDIUM;
        }
        return LOW;
    }
}
