package com.aegis.context.calendar;

import java.time.LocalDate;

/**
 * Scheduled macro event. {@code dDay} is relative to the day the event was
 * bucketed: 0 today, negative in the past.
 */
public record EconomicEvent(String name,
                            LocalDate date,
                            EventCategory category,
                            EventImpact impact,
                            String country,
                            String description,
                            int dDay) {

    public EconomicEvent withDDay(int dDay) {
        return new EconomicEvent(name, date, category, impact, country, description, dDay);
    }
}
