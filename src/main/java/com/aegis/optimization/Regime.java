package com.aegis.optimization;

import java.util.Locale;

/** Broad market regime that selects the base weight set. */
public enum Regime {
    BULL,
    BEAR,
    SIDEWAY;

    /** Case-insensitive lookup; null or unknown names map to {@link #SIDEWAY}. */
    public static Regime parse(String name) {
        if (name == null) {
            return SIDEWAY;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SIDEWAY;
        }
    }
}
