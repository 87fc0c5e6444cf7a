package com.aegis.optimization;

/**
 * Precomputed market volatility supplied by the caller instead of measuring it.
 *
 * @param annualizedVolatilityPct daily-return standard deviation scaled by sqrt(252), in percent
 * @param fiveDayRangePct         (max high - min low) / mean close over five sessions, in percent
 */
public record VolatilitySample(double annualizedVolatilityPct, double fiveDayRangePct) {
}
