package com.aegis.realworld.integrity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Snapshot of one U.S. index future. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class GlobexData {
    /** Short name such as NQ or ES. */
    public final String symbol;
    public final double price;
    public final double change;
    public final double changePct;
    public final long volume;
    /** Time of the newest bar. */
    public final Instant timestamp;
    public final DataSource source;
    public final DataStatus status;
}
