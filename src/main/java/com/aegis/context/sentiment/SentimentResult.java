package com.aegis.context.sentiment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Snapshot of the sentiment meter: raw indicators, score and position multiplier. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SentimentResult {
    public final double vix;
    public final VixLevel vixLevel;
    public final double marketRsi;
    public final RsiSignal rsiSignal;
    public final double creditBalanceRatio;
    public final CreditSignal creditSignal;
    public final double advanceDeclineRatio;
    /** No source is wired for put/call, so this stays null. */
    public final Double putCallRatio;
    public final int sentimentScore;
    public final SentimentLevel sentimentLevel;
    public final MarketCondition marketCondition;
    public final double positionMultiplier;
    public final boolean riskWarning;
    public final String warningMessage;
    public final Instant analyzedAt;
}
