package com.homestead.household.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * JSON (de)serializing accessor over a {@link CacheStore}.
 * <p>
 * Every operation is best effort. A miss, an unreachable store, a timeout and an
 * unreadable entry all look the same to the caller: an empty {@link Optional}.
 * Write and delete failures are logged and counted, never thrown.
 */
@Component
public class TypedCache {

    private static final Logger logger = LoggerFactory.getLogger(TypedCache.class);

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final CacheProperties properties;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder writes = new LongAdder();
    private final LongAdder invalidations = new LongAdder();

    public TypedCache(CacheStore store, ObjectMapper objectMapper, CacheProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return read(key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(CacheKey key, TypeReference<T> type) {
        return read(key, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> Optional<T> read(CacheKey key, JavaType type) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }

        String json;
        try {
            json = store.get(key.value()).orElse(null);
        } catch (Exception e) {
            errors.increment();
            logger.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }

        if (json == null || json.isEmpty()) {
            misses.increment();
            logger.debug("Cache miss for {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            logger.debug("Cache hit for {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            errors.increment();
            logger.warn("Unreadable cache entry {}, treating as miss: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void set(CacheKey key, Object value) {
        set(key, value, properties.getTtl());
    }

    /**
     * Stores the value under the key. A {@code null} or zero TTL keeps it until invalidated.
     */
    public void set(CacheKey key, Object value, Duration ttl) {
        if (!properties.isEnabled() || value == null) {
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(value);
            store.set(key.value(), json, ttl);
            writes.increment();
            logger.debug("Cached {} (TTL: {})", key, ttl);
        } catch (Exception e) {
            errors.increment();
            logger.warn("Failed to cache {}: {}", key, e.getMessage());
        }
    }

    public void delete(CacheKey key) {
        if (!properties.isEnabled()) {
            return;
        }

        try {
            boolean removed = store.delete(key.value());
            invalidations.increment();
            logger.debug("Invalidated {} (present: {})", key, removed);
        } catch (Exception e) {
            errors.increment();
            logger.warn("Failed to invalidate {}, entry may stay stale until TTL: {}", key, e.getMessage());
        }
    }

    public void deleteAll(Collection<CacheKey> keys) {
        keys.forEach(this::delete);
    }

    public CacheStats getStats() {
        return new CacheStats(hits.sum(), misses.sum(), errors.sum(), writes.sum(), invalidations.sum());
    }
}
