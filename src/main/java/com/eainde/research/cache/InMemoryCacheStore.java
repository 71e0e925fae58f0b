package com.eainde.research.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-JVM cache. Default backend for local runs and tests.
 */
public final class InMemoryCacheStore implements CacheStore {

    private record Entry(String value, Instant createdAt, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix;
    private final Clock clock;

    public InMemoryCacheStore(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = clock;
    }

    public InMemoryCacheStore(String prefix) {
        this(prefix, Clock.systemUTC());
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) {
            return Optional.empty();
        }
        if (e.isExpired(clock.instant())) {
            // only evict the entry we saw; a concurrent put must survive
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : now.plus(ttl);
        map.put(k(key), new Entry(value, now, expiresAt));
    }

    @Override
    public void invalidate(String key) {
        map.remove(k(key));
    }

    int size() {
        return map.size();
    }
}
