package com.aegis.global;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Coupling score and adjustment factor for one Korean stock. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CouplingResult {
    public final String stockCode;
    public final String stockName;
    public final CouplingStrength strength;
    public final Map<String, IndexData> relatedUsStocks;
    public final Map<String, IndexData> relatedUsIndices;
    public final MarketSentiment usSentiment;
    public final MarketSentiment sectorSentiment;
    /** -100..+100. */
    public final double couplingScore;
    /** Multiplier for downstream weights, within 1 +/- the strength's max adjustment. */
    public final double adjustmentFactor;
    public final String analysisReason;
    public final Instant analyzedAt;
}
