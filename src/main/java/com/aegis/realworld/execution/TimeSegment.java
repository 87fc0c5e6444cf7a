package com.aegis.realworld.execution;

import java.time.LocalTime;
import java.util.Locale;

/**
 * Intraday segments of the KRX session. Each segment covers
 * {@code [start, end)}; times outside every segment are {@link #CLOSED}.
 */
public enum TimeSegment {
    PREMARKET(LocalTime.of(8, 30), LocalTime.of(9, 0)),
    OPENING(LocalTime.of(9, 0), LocalTime.of(9, 30)),
    MORNING(LocalTime.of(9, 30), LocalTime.of(11, 30)),
    LUNCH(LocalTime.of(11, 30), LocalTime.of(13, 0)),
    AFTERNOON(LocalTime.of(13, 0), LocalTime.of(14, 30)),
    CLOSING(LocalTime.of(14, 30), LocalTime.of(15, 20)),
    AFTER_HOURS(LocalTime.of(15, 30), LocalTime.of(18, 0)),
    CLOSED(null, null);

    private final LocalTime start;
    private final LocalTime end;

    TimeSegment(LocalTime start, LocalTime end) {
        this.start = start;
        this.end = end;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TimeSegment at(LocalTime time) {
        for (TimeSegment s : values()) {
            if (s.start != null && !time.isBefore(s.start) && time.isBefore(s.end)) {
                return s;
            }
        }
        return CLOSED;
    }
}
