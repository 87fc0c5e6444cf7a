package com.aegis.context.calendar;

import com.aegis.config.CalendarData;
import com.aegis.config.Config;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MacroCalendarFetcherTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final CalendarData CALENDAR = CalendarData.load(Config.defaults());

    private static MacroCalendarFetcher at(int year, int month, int day) {
        Clock clock = Clock.fixed(LocalDate.of(year, month, day).atTime(10, 0).atZone(SEOUL).toInstant(), SEOUL);
        return new MacroCalendarFetcher(CALENDAR, clock);
    }

    @Test
    void fomcDayShouldForceReduceWithWarning() {
        CalendarResult result = at(2026, 10, 28).analyze();

        assertEquals(1, result.todayEvents.size());
        assertEquals(EventCategory.FOMC, result.todayEvents.get(0).category());
        assertEquals(0.5, result.riskScore, 1e-9);
        assertEquals(CalendarRiskLevel.HIGH, result.riskLevel);
        assertEquals(0.7, result.positionAdjustment, 1e-9);
        assertTrue(result.shouldReduceExposure);
        assertEquals("⚠️ FOMC 금리결정 발표 당일 - 변동성 주의", result.warningMessage);
    }

    @Test
    void analyzeShouldAcceptAnyNonNegativeHorizon() {
        MacroCalendarFetcher fetcher = at(2026, 10, 28);
        int previousUpcoming = -1;
        for (int daysAhead : new int[]{0, 1, 7, 30, 365, Integer.MAX_VALUE}) {
            CalendarResult result = fetcher.analyze(daysAhead);

            assertTrue(result.riskScore >= 0.0 && result.riskScore <= 1.0, "daysAhead " + daysAhead);
            assertTrue(result.upcomingEvents.size() >= previousUpcoming, "daysAhead " + daysAhead);
            assertTrue(result.upcomingEvents.stream().allMatch(e -> e.dDay() > 0 && e.dDay() <= daysAhead));
            previousUpcoming = result.upcomingEvents.size();
        }
        assertTrue(fetcher.analyze(0).upcomingEvents.isEmpty());
        assertEquals(fetcher.analyze(0).upcomingEvents, fetcher.analyze(-5).upcomingEvents);
    }

    @Test
    void dayBeforeCriticalEventShouldCapAdjustment() {
        CalendarResult result = at(2026, 10, 27).analyze();

        assertEquals(0.3, result.riskScore, 1e-9);
        assertEquals(CalendarRiskLevel.MEDIUM, result.riskLevel);
        assertEquals(0.7, result.positionAdjustment, 1e-9);
        assertTrue(result.shouldReduceExposure);
        assertTrue(result.warningMessage.startsWith("⚠️ 내일 FOMC"));
    }

    @Test
    void quietDayShouldBeLowRiskAndBucketPastWeek() {
        CalendarResult result = at(2026, 10, 19).analyze();

        assertTrue(result.todayEvents.isEmpty());
        assertEquals(CalendarRiskLevel.LOW, result.riskLevel);
        assertEquals(1.0, result.positionAdjustment, 1e-9);
        assertFalse(result.shouldReduceExposure);
        assertNull(result.warningMessage);

        assertEquals(1, result.upcomingEvents.size());
        assertEquals(9, result.upcomingEvents.get(0).dDay());
        assertEquals(3, result.pastWeekEvents.size());
        assertTrue(result.pastWeekEvents.stream().allMatch(e -> e.dDay() >= -7 && e.dDay() < 0));
    }

    @Test
    void scheduleShouldCoverEveryRecurringSeries() {
        List<EconomicEvent> events = at(2026, 1, 1).getScheduledEvents();

        assertEquals(52, events.size());
        assertEquals("FOMC 금리결정", events.get(0).name());
        assertTrue(events.stream().anyMatch(e -> e.category() == EventCategory.OPTIONS
                && e.date().equals(LocalDate.of(2026, 3, 20))));
        assertTrue(events.stream().anyMatch(e -> e.category() == EventCategory.EMPLOYMENT
                && e.date().equals(LocalDate.of(2026, 10, 2))));
    }

    @Test
    void riskScoreShouldBeCappedAtOne() {
        EconomicEvent critical = new EconomicEvent("X", LocalDate.of(2026, 1, 1), EventCategory.OTHER,
                EventImpact.CRITICAL, "US", "", 0);

        assertEquals(1.0, MacroCalendarFetcher.riskScore(List.of(critical, critical, critical), List.of()), 1e-9);
        assertEquals(0.0, MacroCalendarFetcher.riskScore(List.of(), List.of(critical.withDDay(3))), 1e-9);
    }

    @Test
    void lookupsShouldMeasureFromToday() {
        MacroCalendarFetcher fetcher = at(2026, 10, 19);

        Optional<EconomicEvent> next = fetcher.getNextCriticalEvent();
        assertTrue(next.isPresent());
        assertEquals(LocalDate.of(2026, 10, 28), next.get().date());
        assertEquals(9, next.get().dDay());
        assertEquals(Optional.of(18), fetcher.daysUntilEvent(EventCategory.EMPLOYMENT));
        assertTrue(fetcher.isEarningsSeason());

        MacroCalendarFetcher lateDecember = at(2026, 12, 20);
        assertTrue(lateDecember.getNextCriticalEvent().isEmpty());
        assertTrue(lateDecember.daysUntilEvent(EventCategory.FOMC).isEmpty());
        assertFalse(lateDecember.isEarningsSeason());
    }
}
