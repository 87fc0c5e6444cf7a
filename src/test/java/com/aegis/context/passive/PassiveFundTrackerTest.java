package com.aegis.context.passive;

import com.aegis.config.CalendarData;
import com.aegis.config.Config;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassiveFundTrackerTest {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final CalendarData CALENDAR = CalendarData.load(Config.defaults());

    private static PassiveFundTracker at(int year, int month, int day) {
        Clock clock = Clock.fixed(LocalDate.of(year, month, day).atTime(9, 0).atZone(SEOUL).toInstant(), SEOUL);
        return new PassiveFundTracker(CALENDAR, clock);
    }

    private static RebalanceEvent event(RebalanceAction action, String code, LocalDate effective) {
        return new RebalanceEvent(IndexType.KOSPI200, code, code, action,
                effective.minusDays(3), effective, 1200.0, 0.7, "test");
    }

    @Test
    void analyzeShouldPickNearestWindowAcrossIndices() {
        PassiveFlowResult result = at(2026, 10, 19).analyze("005930");

        assertEquals(LocalDate.of(2026, 11, 30), result.nextRebalanceDate);
        assertEquals(42, result.daysUntilRebalance);
        assertTrue(result.stockInMajorIndex);
        assertEquals(15.0, result.estimatedPassiveWeight, 1e-9);
    }

    @Test
    void nextRebalanceShouldCrossIntoFollowingYear() {
        PassiveFlowResult result = at(2025, 12, 12).analyze();

        assertEquals(LocalDate.of(2026, 3, 2), result.nextRebalanceDate);
        assertEquals(80, result.daysUntilRebalance);
        assertFalse(result.stockInMajorIndex);
        assertEquals(0.0, result.estimatedPassiveWeight, 1e-9);
    }

    @Test
    void analyzeShouldReportNoRebalanceAfterLastKnownWindow() {
        PassiveFlowResult result = at(2026, 12, 20).analyze("999999");

        assertNull(result.nextRebalanceDate);
        assertNull(result.daysUntilRebalance);
    }

    @Test
    void predictedChangesShouldBeBucketedByEffectiveDate() {
        PassiveFundTracker tracker = at(2026, 10, 19);
        tracker.addPredictedChange(event(RebalanceAction.ADD, "042700", LocalDate.of(2026, 10, 29)));
        tracker.addPredictedChange(event(RebalanceAction.DELETE, "001440", LocalDate.of(2026, 10, 30)));
        tracker.addPredictedChange(event(RebalanceAction.ADD, "011200", LocalDate.of(2026, 10, 1)));
        tracker.addPredictedChange(event(RebalanceAction.ADD, "003490", LocalDate.of(2026, 8, 1)));

        PassiveFlowResult result = tracker.analyze();

        assertEquals(1, result.upcomingAdditions.size());
        assertEquals(1, result.upcomingDeletions.size());
        assertEquals(1, result.recentChanges.size());
        assertEquals("011200", result.recentChanges.get(0).stockCode());
    }

    @Test
    void candidatesShouldRespectLeadWindow() {
        PassiveFundTracker tracker = at(2026, 10, 19);
        tracker.addPredictedChange(event(RebalanceAction.ADD, "042700", LocalDate.of(2026, 10, 29)));
        tracker.addPredictedChange(event(RebalanceAction.DELETE, "001440", LocalDate.of(2026, 10, 30)));
        tracker.addPredictedChange(event(RebalanceAction.ADD, "011200", LocalDate.of(2026, 10, 19)));

        assertEquals(1, tracker.getBuyCandidates().size());
        assertEquals(0, tracker.getBuyCandidates(9).size());
        assertTrue(tracker.getSellCandidates().isEmpty());
        assertEquals(1, tracker.getSellCandidates(14).size());
    }

    @Test
    void passiveFlowShouldScaleWithMarketCap() {
        PassiveFundTracker tracker = at(2026, 10, 19);

        assertEquals(1000.0, tracker.estimatePassiveFlow(IndexType.KOSPI200, 2.0), 1e-9);
        assertEquals(1600.0, tracker.estimatePassiveFlow(IndexType.MSCI_KOREA, 2.0), 1e-9);
        assertEquals(0.0, tracker.estimatePassiveFlow(IndexType.KOSDAQ150, 2.0), 1e-9);
    }
}
