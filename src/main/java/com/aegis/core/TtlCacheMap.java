package com.aegis.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Per-key {@link TtlCache}. Different keys refresh independently.
 */
public final class TtlCacheMap<K, V> {
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<K, TtlCache<V>> entries = new ConcurrentHashMap<>();

    public TtlCacheMap(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public V getOrRefresh(K key, Supplier<V> loader, boolean force) {
        return entries.computeIfAbsent(key, k -> new TtlCache<>(ttl, clock)).getOrRefresh(loader, force);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
