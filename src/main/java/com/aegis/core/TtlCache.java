package com.aegis.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Holds one value for a fixed time-to-live.
 *
 * <p>Refreshes are single flight: when the entry is expired, the first caller
 * runs the loader while concurrent callers block on the same lock and then
 * observe the freshly stored value. A loader returning {@code null} or
 * throwing leaves the previous state untouched.
 */
public final class TtlCache<T> {
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private T value;
    private Instant loadedAt;

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public T getOrRefresh(Supplier<T> loader, boolean force) {
        Objects.requireNonNull(loader, "loader");
        lock.lock();
        try {
            if (!force && isFreshLocked()) {
                return value;
            }
            T loaded = loader.get();
            if (loaded != null) {
                value = loaded;
                loadedAt = clock.instant();
            }
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            value = null;
            loadedAt = null;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFreshLocked() {
        if (value == null || loadedAt == null) {
            return false;
        }
        return Duration.between(loadedAt, clock.instant()).compareTo(ttl) < 0;
    }
}
