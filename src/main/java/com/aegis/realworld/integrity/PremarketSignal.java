package com.aegis.realworld.integrity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Expected opening gap with its weight adjustment, derived from Nasdaq futures. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PremarketSignal {
    public final PremarketGap signal;
    public final String bias;
    public final double nqChangePct;
    public final double weightAdjustment;
    public final String recommendation;
    public final Instant generatedAt;
}
