package com.aegis.context.sector;

import java.time.LocalDate;
import java.util.List;

/**
 * Industry event instantiated for a calendar year. {@code endDate} equals
 * {@code startDate} for single-day events.
 */
public record SectorEvent(String name,
                          SectorEventType type,
                          List<SectorType> sectors,
                          LocalDate startDate,
                          LocalDate endDate,
                          String location,
                          SectorImpact impact,
                          List<String> relatedStocks,
                          String description,
                          String tradingStrategy) {
    public SectorEvent {
        sectors = List.copyOf(sectors);
        relatedStocks = List.copyOf(relatedStocks);
    }
}
