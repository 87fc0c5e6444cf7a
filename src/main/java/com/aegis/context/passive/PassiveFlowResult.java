package com.aegis.context.passive;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Rebalance timing, predicted index changes and passive exposure for one stock. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PassiveFlowResult {
    public final List<RebalanceEvent> upcomingAdditions;
    public final List<RebalanceEvent> upcomingDeletions;
    public final List<RebalanceEvent> recentChanges;
    public final boolean stockInMajorIndex;
    public final double estimatedPassiveWeight;
    /** Null when no rebalance remains in the loaded schedules. */
    public final LocalDate nextRebalanceDate;
    public final Integer daysUntilRebalance;
    public final Instant analyzedAt;
}
