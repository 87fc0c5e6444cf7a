package com.aegis.global;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Last price and one-session change of a U.S. index, stock, future or FX rate. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class IndexData {
    public final String symbol;
    public final String name;
    public final double price;
    public final double change;
    public final double changePct;
    public final long volume;
    public final Instant timestamp;
}
