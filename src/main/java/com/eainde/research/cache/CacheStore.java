package com.eainde.research.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry expiry fronting stage calls.
 * <p>
 * Implementations are linearizable per key. An expired entry reads as a miss.
 * A backend that cannot be reached throws
 * {@link com.eainde.research.exception.CacheUnavailableException}.
 * </p>
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * @param ttl time to live; {@code null}, zero or negative means no expiry
     */
    void put(String key, String value, Duration ttl);

    void invalidate(String key);
}
