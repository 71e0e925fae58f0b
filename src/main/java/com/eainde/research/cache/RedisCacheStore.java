package com.eainde.research.cache;

import com.eainde.research.exception.CacheUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed cache using {@link StringRedisTemplate}; expiry is delegated to Redis.
 * Keys are prefixed with the provided prefix (e.g. "research:").
 */
public final class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisCacheStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(k(key)));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis read failed for " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        final String k = k(key);
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(k, value);
            } else {
                redis.opsForValue().set(k, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis write failed for " + key, e);
        }
    }

    @Override
    public void invalidate(String key) {
        try {
            redis.delete(k(key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Redis delete failed for " + key, e);
        }
    }
}
