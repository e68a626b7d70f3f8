package com.homestead.household.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Raw key/value store behind {@link TypedCache}.
 * Implementations may throw on any store-level failure; callers decide how to degrade.
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * Stores the value. A {@code null}, zero or negative TTL keeps it until deleted.
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return whether a value was present
     */
    boolean delete(String key);
}
