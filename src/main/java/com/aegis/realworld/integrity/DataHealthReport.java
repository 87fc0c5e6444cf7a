package com.aegis.realworld.integrity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Freshness and probe latency of each monitored source. */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DataHealthReport {
    public final DataStatus overallStatus;
    public final Map<String, DataStatus> sources;
    /** Probe latency in milliseconds, only for sources that answered. */
    public final Map<String, Long> latencies;
    public final Map<String, Instant> lastUpdate;
    public final List<String> warnings;
    public final Instant generatedAt;
}
