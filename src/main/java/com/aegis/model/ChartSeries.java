package com.aegis.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Parsed chart response: bars in time order plus the previous session close
 * reported in the chart metadata (null when the payload omits it).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ChartSeries {
    public final String symbol;
    public final List<PriceBar> bars;
    public final Double previousClose;

    public boolean isEmpty() {
        return bars == null || bars.isEmpty();
    }

    public PriceBar last() {
        return isEmpty() ? null : bars.get(bars.size() - 1);
    }
}
