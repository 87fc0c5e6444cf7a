package com.aegis.context.calendar;

/** Expected market impact of a macro event. */
public enum EventImpact {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
