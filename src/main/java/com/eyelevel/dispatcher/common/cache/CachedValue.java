package com.eyelevel.dispatcher.common.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds a value produced by a loader and reloads it once it is older than the time-to-live.
 * Reads never block on a reload performed by another thread; they see the previous value until
 * the new one is published.
 *
 * @param <T> the cached value type
 */
@Slf4j
public class CachedValue<T> {

    private final String name;
    private final Supplier<T> loader;
    private final Duration ttl;
    private final Clock clock;

    private volatile T value;
    private volatile Instant lastRefreshed;

    public CachedValue(final String name, final Supplier<T> loader, final Duration ttl, final Clock clock) {
        this.name = name;
        this.loader = Objects.requireNonNull(loader, "loader");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the current value, loading it on first use.
     */
    public T get() {
        T current = value;
        if (current == null) {
            return refresh();
        }
        return current;
    }

    /**
     * Reloads the value when it has never been loaded or is older than the time-to-live.
     *
     * @return {@code true} if a reload took place.
     */
    public boolean refreshIfStale() {
        final Instant refreshed = lastRefreshed;
        if (refreshed == null || !clock.instant().isBefore(refreshed.plus(ttl))) {
            refresh();
            return true;
        }
        return false;
    }

    /**
     * Unconditionally reloads the value. If the loader fails, the previous value is kept and the
     * exception propagates.
     */
    public synchronized T refresh() {
        final T loaded = Objects.requireNonNull(loader.get(), "loader returned null");
        value = loaded;
        lastRefreshed = clock.instant();
        log.debug("Refreshed cached value '{}'", name);
        return loaded;
    }

    public Instant lastRefreshed() {
        return lastRefreshed;
    }
}
