package com.aegis.optimization;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Outcome of a robustness run across the stock panel and all three periods. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RobustnessResult {
    public final boolean passed;
    /** Last drawdown breach, null when passed. */
    public final String failReason;
    public final int stocksTested;
    public final int periodsTested;
    public final double avgWinRate;
    public final double avgMdd;
    public final double maxMdd;
    public final double avgCagr;
    public final List<BacktestRun> individualResults;
    public final Instant testedAt;
}
