package com.homestead.household.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.port.out.DomainEventPublisher;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs reads and writes of the domain services against the cache and the system of record.
 * <p>
 * Reads: cache first, loader on miss, best-effort write-back.
 * <p>
 * Writes, in order: delete the invalidation set, run the write, publish one event,
 * refill the requested keys. A failing write aborts the rest and propagates.
 * An event function may return {@code null} for a write that changed nothing.
 * Cache and publish failures never do.
 * <p>
 * There is no locking. Two concurrent writers on the same entity can interleave so
 * that a refill of the older value lands after the newer invalidation; such an entry
 * lives until its TTL expires.
 */
@Component
public class CacheAsideTemplate {

    private static final Logger logger = LoggerFactory.getLogger(CacheAsideTemplate.class);

    private final TypedCache cache;
    private final DomainEventPublisher eventPublisher;

    public CacheAsideTemplate(TypedCache cache, DomainEventPublisher eventPublisher) {
        this.cache = cache;
        this.eventPublisher = eventPublisher;
    }

    public <T> T readThrough(CacheKey key, Class<T> type, Supplier<T> loader) {
        return loadOnMiss(key, cache.get(key, type), loader, value -> true);
    }

    public <T> T readThrough(CacheKey key, TypeReference<T> type, Supplier<T> loader) {
        return loadOnMiss(key, cache.get(key, type), loader, value -> true);
    }

    /**
     * Read-through that only writes back loaded values accepted by {@code cacheable}.
     */
    public <T> T readThrough(CacheKey key, TypeReference<T> type, Supplier<T> loader, Predicate<? super T> cacheable) {
        return loadOnMiss(key, cache.get(key, type), loader, cacheable);
    }

    /**
     * Read-through for lookups that may legitimately find nothing. Absence is not cached.
     */
    public <T> Optional<T> readThroughOptional(CacheKey key, Class<T> type, Supplier<Optional<T>> loader) {
        Optional<T> cached = cache.get(key, type);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<T> loaded = loader.get();
        loaded.ifPresent(value -> cache.set(key, value));
        return loaded;
    }

    private <T> T loadOnMiss(CacheKey key, Optional<T> cached, Supplier<T> loader, Predicate<? super T> cacheable) {
        if (cached.isPresent()) {
            return cached.get();
        }

        logger.debug("Loading {} from system of record", key);
        T value = loader.get();
        if (cacheable.test(value)) {
            cache.set(key, value);
        }
        return value;
    }

    public <R> R execute(CacheMutation<R> mutation) {
        cache.deleteAll(mutation.invalidations());

        R result = mutation.write().get();

        publish(mutation, result);

        for (CacheMutation.Repopulation<R> repopulation : mutation.repopulations()) {
            repopulate(repopulation, result);
        }

        return result;
    }

    private <R> void publish(CacheMutation<R> mutation, R result) {
        try {
            DomainEvent event = mutation.event().apply(result);
            if (event == null) {
                logger.debug("Write changed nothing, no event to publish");
                return;
            }
            eventPublisher.publish(event);
        } catch (Exception e) {
            logger.warn("Write committed but its event could not be published: {}", e.getMessage());
        }
    }

    private <R> void repopulate(CacheMutation.Repopulation<R> repopulation, R result) {
        try {
            cache.set(repopulation.key(), repopulation.value().apply(result));
        } catch (Exception e) {
            logger.warn("Skipping refill of {}: {}", repopulation.key(), e.getMessage());
        }
    }
}
