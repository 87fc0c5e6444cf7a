package com.aegis.context.sector;

import com.aegis.config.CalendarData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Watches recurring industry events (trade shows, medical congresses,
 * shopping seasons) and ranks sectors by how close their events are.
 *
 * <p>Event dates come from {@link CalendarData} and are instantiated for the
 * current year on every call. No network access; results depend only on the
 * clock and the bundled calendar.
 */
public class SectorEventMonitor {
    private static final Logger LOG = LogManager.getLogger(SectorEventMonitor.class);

    private static final int UPCOMING_DAYS = 60;
    private static final int RECENT_DAYS = 14;
    private static final int SCORING_DAYS = 30;
    private static final int CANDIDATE_DAYS = 14;
    private static final double HOT_THRESHOLD = 50.0;

    private final CalendarData calendar;
    private final Clock clock;

    public SectorEventMonitor(CalendarData calendar, Clock clock) {
        this.calendar = calendar;
        this.clock = clock;
    }

    public SectorAnalysisResult analyze() {
        return analyze(null);
    }

    public SectorAnalysisResult analyze(SectorType targetSector) {
        LocalDate today = LocalDate.now(clock);
        List<SectorEvent> upcoming = new ArrayList<>();
        List<SectorEvent> active = new ArrayList<>();
        List<SectorEvent> recent = new ArrayList<>();

        for (SectorEvent event : eventsForYear(today.getYear())) {
            if (targetSector != null && !event.sectors().contains(targetSector)) {
                continue;
            }
            if (event.startDate().isAfter(today)) {
                if (ChronoUnit.DAYS.between(today, event.startDate()) <= UPCOMING_DAYS) {
                    upcoming.add(event);
                }
            } else if (!today.isAfter(event.endDate())) {
                active.add(event);
            } else if (ChronoUnit.DAYS.between(event.endDate(), today) <= RECENT_DAYS) {
                recent.add(event);
            }
        }
        upcoming.sort(Comparator.comparing(SectorEvent::startDate));

        Map<SectorType, Double> scores = sectorScores(upcoming, active, today);
        List<SectorType> hot = new ArrayList<>();
        for (Map.Entry<SectorType, Double> e : scores.entrySet()) {
            if (e.getValue() >= HOT_THRESHOLD) {
                hot.add(e.getKey());
            }
        }

        SectorAnalysisResult result = SectorAnalysisResult.builder()
                .upcomingEvents(List.copyOf(upcoming))
                .activeEvents(List.copyOf(active))
                .recentEvents(List.copyOf(recent))
                .hotSectors(List.copyOf(hot))
                .sectorScores(scores)
                .buyCandidates(buyCandidates(upcoming, active, today))
                .analyzedAt(clock.instant())
                .build();
        LOG.debug("sector events: upcoming={} active={} hot={}", upcoming.size(), active.size(), hot);
        return result;
    }

    /** Events of the current year whose related stocks include the code. */
    public List<SectorEvent> getEventsForStock(String stockCode) {
        List<SectorEvent> out = new ArrayList<>();
        for (SectorEvent event : eventsForYear(LocalDate.now(clock).getYear())) {
            if (event.relatedStocks().contains(stockCode)) {
                out.add(event);
            }
        }
        return out;
    }

    public List<SectorEvent> eventsForYear(int year) {
        List<SectorEvent> out = new ArrayList<>();
        for (CalendarData.SectorEventSpec spec : calendar.sectorEvents()) {
            List<SectorType> sectors = new ArrayList<>();
            for (String s : spec.sectors()) {
                sectors.add(SectorType.valueOf(s.toUpperCase(Locale.ROOT)));
            }
            out.add(new SectorEvent(
                    spec.name(),
                    SectorEventType.valueOf(spec.type().toUpperCase(Locale.ROOT)),
                    sectors,
                    spec.start().atYear(year),
                    spec.end().atYear(year),
                    spec.location(),
                    SectorImpact.valueOf(spec.impact().toUpperCase(Locale.ROOT)),
                    spec.relatedStocks(),
                    spec.description(),
                    spec.strategy()));
        }
        return out;
    }

    static Map<SectorType, Double> sectorScores(List<SectorEvent> upcoming, List<SectorEvent> active, LocalDate today) {
        Map<SectorType, Double> raw = new EnumMap<>(SectorType.class);
        for (SectorEvent event : active) {
            for (SectorType sector : event.sectors()) {
                raw.merge(sector, event.impact().weight() * 2.0, Double::sum);
            }
        }
        for (SectorEvent event : upcoming) {
            long daysUntil = ChronoUnit.DAYS.between(today, event.startDate());
            if (daysUntil > SCORING_DAYS) {
                continue;
            }
            double timeWeight = 1.0 + (SCORING_DAYS - daysUntil) / (double) SCORING_DAYS;
            for (SectorType sector : event.sectors()) {
                raw.merge(sector, event.impact().weight() * timeWeight, Double::sum);
            }
        }

        double max = 0.0;
        for (double v : raw.values()) {
            max = Math.max(max, v);
        }
        Map<SectorType, Double> scaled = new EnumMap<>(SectorType.class);
        if (max <= 0.0) {
            return scaled;
        }
        for (Map.Entry<SectorType, Double> e : raw.entrySet()) {
            scaled.put(e.getKey(), Math.round(e.getValue() / max * 1000.0) / 10.0);
        }
        return scaled;
    }

    static List<String> buyCandidates(List<SectorEvent> upcoming, List<SectorEvent> active, LocalDate today) {
        TreeSet<String> codes = new TreeSet<>();
        for (SectorEvent event : active) {
            if (event.impact() == SectorImpact.HIGH || event.impact() == SectorImpact.MEDIUM) {
                codes.addAll(event.relatedStocks());
            }
        }
        for (SectorEvent event : upcoming) {
            if (event.impact() == SectorImpact.HIGH
                    && ChronoUnit.DAYS.between(today, event.startDate()) <= CANDIDATE_DAYS) {
                codes.addAll(event.relatedStocks());
            }
        }
        return List.copyOf(codes);
    }
}
