package com.aegis.context.sector;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Sector events around today, sector scores and the resulting buy candidates. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SectorAnalysisResult {
    public final List<SectorEvent> upcomingEvents;
    public final List<SectorEvent> activeEvents;
    public final List<SectorEvent> recentEvents;
    /** Sectors scoring 50 or more. */
    public final List<SectorType> hotSectors;
    /** 0..100 relative to the busiest sector. */
    public final Map<SectorType, Double> sectorScores;
    public final List<String> buyCandidates;
    public final Instant analyzedAt;
}
