package com.clapgrow.summary.common.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-bounded memoization of idempotent read calls.
 *
 * <p>The TTL is fixed per instance, so different endpoint classes (group listings,
 * instance-state checks) get their own caches. An entry older than the TTL is
 * reported as a miss but stays in storage until it is overwritten or the cache is
 * cleared; the key space is one entry per endpoint/argument combination.
 *
 * <p>Reads may come from any thread. Writes are expected from a single owner.
 *
 * @param <V> cached value type
 */
@Slf4j
public class ResponseCache<V> {

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public ResponseCache(String name, Duration ttl, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative");
        }
    }

    public Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant expiresAt = entry.recordedAt().plus(ttl);
        if (!clock.instant().isBefore(expiresAt)) {
            log.debug("Cache {} entry {} expired at {}", name, key, expiresAt);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void set(String key, V value) {
        Objects.requireNonNull(value, "value");
        entries.put(key, new CacheEntry<>(value, clock.instant()));
    }

    public void clear() {
        entries.clear();
        log.debug("Cache {} cleared", name);
    }

    public Duration getTtl() {
        return ttl;
    }
}
