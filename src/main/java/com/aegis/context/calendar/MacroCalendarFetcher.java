package com.aegis.context.calendar;

import com.aegis.config.CalendarData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tracks scheduled U.S. and Korean macro events and turns their proximity into
 * a position adjustment.
 *
 * <p>FOMC days come from {@link CalendarData}; the other events follow fixed
 * day-of-month rules. The calendar is rebuilt for the current year on each call
 * and D-day values are relative to the injected clock.
 */
public class MacroCalendarFetcher {
    private static final Logger LOG = LogManager.getLogger(MacroCalendarFetcher.class);

    public static final int DEFAULT_DAYS_AHEAD = 14;

    private static final int[][] EARNINGS_WINDOWS = {
            {1, 15, 2, 15},
            {4, 15, 5, 15},
            {7, 15, 8, 15},
            {10, 15, 11, 15},
    };
    private static final String[] EARNINGS_NAMES = {"Q4 실적시즌", "Q1 실적시즌", "Q2 실적시즌", "Q3 실적시즌"};

    private final CalendarData calendar;
    private final Clock clock;

    public MacroCalendarFetcher(CalendarData calendar, Clock clock) {
        this.calendar = calendar;
        this.clock = clock;
    }

    public CalendarResult analyze() {
        return analyze(DEFAULT_DAYS_AHEAD);
    }

    public CalendarResult analyze(int daysAhead) {
        int horizon = Math.max(0, daysAhead);
        LocalDate today = LocalDate.now(clock);

        List<EconomicEvent> upcoming = new ArrayList<>();
        List<EconomicEvent> todays = new ArrayList<>();
        List<EconomicEvent> pastWeek = new ArrayList<>();
        for (EconomicEvent event : getScheduledEvents()) {
            int dDay = (int) ChronoUnit.DAYS.between(today, event.date());
            EconomicEvent dated = event.withDDay(dDay);
            if (dDay == 0) {
                todays.add(dated);
            } else if (dDay > 0 && dDay <= horizon) {
                upcoming.add(dated);
            } else if (dDay < 0 && dDay >= -7) {
                pastWeek.add(dated);
            }
        }
        upcoming.sort(Comparator.comparing(EconomicEvent::date));

        double score = riskScore(todays, upcoming);
        CalendarRiskLevel level = CalendarRiskLevel.ofScore(score);
        double adjustment = level.positionAdjustment();
        boolean reduce = level.reduceExposure();
        String warning = null;

        for (EconomicEvent event : todays) {
            if (event.impact() == EventImpact.CRITICAL) {
                warning = "⚠️ " + event.name() + " 발표 당일 - 변동성 주의";
                reduce = true;
                break;
            }
            if (event.impact() == EventImpact.HIGH) {
                warning = "📅 " + event.name() + " 발표 당일";
            }
        }
        if (warning == null) {
            for (EconomicEvent event : upcoming) {
                if (event.dDay() == 1 && event.impact() == EventImpact.CRITICAL) {
                    warning = "⚠️ 내일 " + event.name() + " - 신규 매수 자제 권고";
                    reduce = true;
                    adjustment = Math.min(adjustment, 0.7);
                    break;
                }
            }
        }

        LOG.debug("calendar risk {} ({}) today={} upcoming={}", level.code(), score, todays.size(), upcoming.size());
        return CalendarResult.builder()
                .upcomingEvents(Collections.unmodifiableList(upcoming))
                .todayEvents(Collections.unmodifiableList(todays))
                .pastWeekEvents(Collections.unmodifiableList(pastWeek))
                .riskLevel(level)
                .riskScore(score)
                .positionAdjustment(adjustment)
                .shouldReduceExposure(reduce)
                .warningMessage(warning)
                .analyzedAt(clock.instant())
                .build();
    }

    static double riskScore(List<EconomicEvent> todays, List<EconomicEvent> upcoming) {
        double score = 0.0;
        for (EconomicEvent event : todays) {
            switch (event.impact()) {
                case CRITICAL -> score += 0.5;
                case HIGH -> score += 0.3;
                case MEDIUM -> score += 0.1;
                default -> {
                }
            }
        }
        for (EconomicEvent event : upcoming) {
            if (event.dDay() > 2) {
                continue;
            }
            if (event.impact() == EventImpact.CRITICAL) {
                score += 0.3;
            } else if (event.impact() == EventImpact.HIGH) {
                score += 0.15;
            }
        }
        score = Math.min(1.0, score);
        return Math.round(score * 100.0) / 100.0;
    }

    /** All events of the current year in generation order: FOMC, CPI, jobs, witching, BOK, earnings. */
    public List<EconomicEvent> getScheduledEvents() {
        int year = LocalDate.now(clock).getYear();
        List<EconomicEvent> events = new ArrayList<>();

        for (LocalDate d : calendar.fomcDates(year)) {
            events.add(new EconomicEvent("FOMC 금리결정", d, EventCategory.FOMC, EventImpact.CRITICAL,
                    "US", "연준 기준금리 결정 및 경제전망 발표", 0));
        }
        for (int month = 1; month <= 12; month++) {
            int day = month % 2 == 0 ? 12 : 13;
            events.add(new EconomicEvent("미국 CPI (" + month + "월)", LocalDate.of(year, month, day),
                    EventCategory.INFLATION, EventImpact.HIGH, "US", "소비자물가지수 발표", 0));
        }
        for (int month = 1; month <= 12; month++) {
            LocalDate firstFriday = LocalDate.of(year, month, 1).with(TemporalAdjusters.firstInMonth(DayOfWeek.FRIDAY));
            events.add(new EconomicEvent("미국 고용보고서 (" + month + "월)", firstFriday,
                    EventCategory.EMPLOYMENT, EventImpact.HIGH, "US", "비농업 고용 및 실업률 발표", 0));
        }
        for (int month = 3; month <= 12; month += 3) {
            LocalDate thirdFriday = LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(3, DayOfWeek.FRIDAY));
            events.add(new EconomicEvent("네 마녀의 날 (Q" + month / 3 + ")", thirdFriday,
                    EventCategory.OPTIONS, EventImpact.HIGH, "GLOBAL",
                    "주가지수 선물/옵션, 개별주식 선물/옵션 동시 만기", 0));
        }
        for (int month = 1; month <= 12; month++) {
            int day = month % 2 == 1 ? 11 : 13;
            events.add(new EconomicEvent("한국 금통위 (" + month + "월)", LocalDate.of(year, month, day),
                    EventCategory.KOREA_MACRO, EventImpact.MEDIUM, "KR", "한국은행 기준금리 결정", 0));
        }
        for (int i = 0; i < EARNINGS_WINDOWS.length; i++) {
            int[] w = EARNINGS_WINDOWS[i];
            events.add(new EconomicEvent(EARNINGS_NAMES[i], LocalDate.of(year, w[0], w[1]),
                    EventCategory.EARNINGS, EventImpact.MEDIUM, "US", "미국 주요 기업 실적발표 시즌", 0));
        }
        return events;
    }

    public Optional<EconomicEvent> getNextCriticalEvent() {
        LocalDate today = LocalDate.now(clock);
        return getScheduledEvents().stream()
                .filter(e -> e.impact() == EventImpact.CRITICAL && !e.date().isBefore(today))
                .min(Comparator.comparing(EconomicEvent::date))
                .map(e -> e.withDDay((int) ChronoUnit.DAYS.between(today, e.date())));
    }

    public boolean isEarningsSeason() {
        LocalDate today = LocalDate.now(clock);
        MonthDay md = MonthDay.from(today);
        for (int[] w : EARNINGS_WINDOWS) {
            MonthDay start = MonthDay.of(w[0], w[1]);
            MonthDay end = MonthDay.of(w[2], w[3]);
            if (!md.isBefore(start) && !md.isAfter(end)) {
                return true;
            }
        }
        return false;
    }

    /** Days until the next event of the category, empty when none remains this year. */
    public Optional<Integer> daysUntilEvent(EventCategory category) {
        LocalDate today = LocalDate.now(clock);
        return getScheduledEvents().stream()
                .filter(e -> e.category() == category && !e.date().isBefore(today))
                .min(Comparator.comparing(EconomicEvent::date))
                .map(e -> (int) ChronoUnit.DAYS.between(today, e.date()));
    }
}
