package com.aegis.context.calendar;

/** Kind of scheduled macro event. */
public enum EventCategory {
    FOMC,
    INFLATION,
    EMPLOYMENT,
    EARNINGS,
    OPTIONS,
    KOREA_MACRO,
    OTHER
}
