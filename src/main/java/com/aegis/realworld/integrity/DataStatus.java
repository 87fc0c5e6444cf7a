package com.aegis.realworld.integrity;

import java.time.Duration;
import java.util.Locale;

/** Freshness of a data source, classified by the age of its newest point. */
public enum DataStatus {
    FRESH,
    STALE,
    OUTDATED,
    UNAVAILABLE;

    static final Duration FRESH_LIMIT = Duration.ofMinutes(5);
    static final Duration STALE_LIMIT = Duration.ofHours(1);

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Classifies by the age of the newest data point; a negative age counts as fresh. */
    public static DataStatus ofAge(Duration age) {
        if (age.compareTo(FRESH_LIMIT) <= 0) {
            return FRESH;
        }
        if (age.compareTo(STALE_LIMIT) <= 0) {
            return STALE;
        }
        return OUTDATED;
    }
}
