package com.aegis.context.passive;

import com.aegis.config.CalendarData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks MSCI Korea and KOSPI200 rebalance windows and predicted index changes.
 *
 * <p>Schedules come from {@link CalendarData}. Predicted additions and
 * deletions are registered by the caller and kept in memory; membership and
 * weight lookups use fixed tables and default to absent.
 */
public class PassiveFundTracker {
    private static final Logger LOG = LogManager.getLogger(PassiveFundTracker.class);

    private static final Set<String> KOSPI200_MAJOR = Set.of(
            "005930", "000660", "035420", "035720", "005380", "000270", "068270",
            "051910", "006400", "015760", "055550", "105560", "086790", "316140");

    private static final Map<String, Double> PASSIVE_WEIGHT = Map.of(
            "005930", 15.0,
            "000660", 5.0,
            "035420", 2.5,
            "035720", 1.5,
            "015760", 1.0,
            "316140", 0.8);

    /** Expected passive flow in 100M KRW per 1T KRW of market cap. */
    private static final Map<IndexType, Double> FLOW_PER_TRILLION = new EnumMap<>(Map.of(
            IndexType.KOSPI200, 500.0,
            IndexType.MSCI_KOREA, 800.0));

    private final CalendarData calendar;
    private final Clock clock;
    private final List<RebalanceEvent> predictedChanges = new CopyOnWriteArrayList<>();

    public PassiveFundTracker(CalendarData calendar, Clock clock) {
        this.calendar = calendar;
        this.clock = clock;
    }

    public PassiveFlowResult analyze() {
        return analyze(null);
    }

    public PassiveFlowResult analyze(String stockCode) {
        LocalDate today = LocalDate.now(clock);
        LocalDate recentFloor = today.minusDays(30);

        List<RebalanceEvent> additions = new ArrayList<>();
        List<RebalanceEvent> deletions = new ArrayList<>();
        List<RebalanceEvent> recent = new ArrayList<>();
        for (RebalanceEvent e : predictedChanges) {
            if (e.effectiveDate().isAfter(today)) {
                if (e.action() == RebalanceAction.ADD) {
                    additions.add(e);
                } else if (e.action() == RebalanceAction.DELETE) {
                    deletions.add(e);
                }
            } else if (!e.effectiveDate().isBefore(recentFloor)) {
                recent.add(e);
            }
        }

        LocalDate next = nextRebalanceDate(today);
        return PassiveFlowResult.builder()
                .upcomingAdditions(List.copyOf(additions))
                .upcomingDeletions(List.copyOf(deletions))
                .recentChanges(List.copyOf(recent))
                .stockInMajorIndex(isInMajorIndex(stockCode))
                .estimatedPassiveWeight(estimatePassiveWeight(stockCode))
                .nextRebalanceDate(next)
                .daysUntilRebalance(next == null ? null : (int) ChronoUnit.DAYS.between(today, next))
                .analyzedAt(clock.instant())
                .build();
    }

    public void addPredictedChange(RebalanceEvent event) {
        predictedChanges.add(event);
        LOG.info("added predicted change: {} {} {}", event.indexType(), event.stockCode(), event.action());
    }

    public List<RebalanceEvent> getBuyCandidates() {
        return getBuyCandidates(14);
    }

    public List<RebalanceEvent> getBuyCandidates(int daysBefore) {
        return candidates(RebalanceAction.ADD, daysBefore);
    }

    public List<RebalanceEvent> getSellCandidates() {
        return getSellCandidates(7);
    }

    public List<RebalanceEvent> getSellCandidates(int daysBefore) {
        return candidates(RebalanceAction.DELETE, daysBefore);
    }

    /** Expected passive flow (100M KRW) for an inclusion of the given size; 0 for untracked indices. */
    public double estimatePassiveFlow(IndexType index, double marketCapTrillionKrw) {
        return FLOW_PER_TRILLION.getOrDefault(index, 0.0) * marketCapTrillionKrw;
    }

    public boolean isInMajorIndex(String stockCode) {
        return stockCode != null && KOSPI200_MAJOR.contains(stockCode);
    }

    public double estimatePassiveWeight(String stockCode) {
        return stockCode == null ? 0.0 : PASSIVE_WEIGHT.getOrDefault(stockCode, 0.0);
    }

    private List<RebalanceEvent> candidates(RebalanceAction action, int window) {
        LocalDate today = LocalDate.now(clock);
        List<RebalanceEvent> out = new ArrayList<>();
        for (RebalanceEvent e : predictedChanges) {
            if (e.action() != action) {
                continue;
            }
            long daysUntil = ChronoUnit.DAYS.between(today, e.effectiveDate());
            if (daysUntil > 0 && daysUntil <= window) {
                out.add(e);
            }
        }
        return out;
    }

    private LocalDate nextRebalanceDate(LocalDate today) {
        LocalDate next = null;
        for (List<CalendarData.RebalanceWindow> windows : calendar.allRebalanceWindows().values()) {
            for (CalendarData.RebalanceWindow w : windows) {
                LocalDate effective = w.effectiveDate();
                if (effective.isAfter(today) && (next == null || effective.isBefore(next))) {
                    next = effective;
                }
            }
        }
        return next;
    }
}
