package com.aegis.context.calendar;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Macro events around today and the position adjustment they imply. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CalendarResult {
    public final List<EconomicEvent> upcomingEvents;
    public final List<EconomicEvent> todayEvents;
    public final List<EconomicEvent> pastWeekEvents;
    public final CalendarRiskLevel riskLevel;
    /** 0.0 to 1.0, two decimals. */
    public final double riskScore;
    public final double positionAdjustment;
    public final boolean shouldReduceExposure;
    public final String warningMessage;
    public final Instant analyzedAt;
}
