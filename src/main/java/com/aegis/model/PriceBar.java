package com.aegis.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One OHLCV bar from the chart API. Daily and minute bars share this shape.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PriceBar {
    public final Instant time;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public static PriceBar ofClose(Instant time, double close) {
        return new PriceBar(time, close, close, close, close, 0.0);
    }
}
