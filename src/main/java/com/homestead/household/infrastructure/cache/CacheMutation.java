package com.homestead.household.infrastructure.cache;

import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.infrastructure.cache.key.CacheKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One write as seen by {@link CacheAsideTemplate}: the keys to drop before it,
 * the write itself, the event describing it and the keys worth refilling afterwards.
 * <p>
 * The invalidation set must be complete when the mutation is built. Anything the
 * write destroys (a parent id, an assignee) has to be read beforehand.
 *
 * @param <R> result of the write
 */
public final class CacheMutation<R> {

    private final Set<CacheKey> invalidations;
    private final Supplier<R> write;
    private final Function<? super R, DomainEvent> event;
    private final List<Repopulation<R>> repopulations;

    private CacheMutation(Builder<R> builder) {
        this.invalidations = Collections.unmodifiableSet(new LinkedHashSet<>(builder.invalidations));
        this.write = builder.write;
        this.event = builder.event;
        this.repopulations = List.copyOf(builder.repopulations);
    }

    public static <R> Builder<R> writing(Supplier<R> write) {
        return new Builder<>(write);
    }

    public static Builder<Void> running(Runnable write) {
        Objects.requireNonNull(write, "write");
        return new Builder<>(() -> {
            write.run();
            return null;
        });
    }

    public Set<CacheKey> invalidations() {
        return invalidations;
    }

    Supplier<R> write() {
        return write;
    }

    Function<? super R, DomainEvent> event() {
        return event;
    }

    List<Repopulation<R>> repopulations() {
        return repopulations;
    }

    record Repopulation<R>(CacheKey key, Function<? super R, ?> value) {}

    public static final class Builder<R> {

        private final Set<CacheKey> invalidations = new LinkedHashSet<>();
        private final Supplier<R> write;
        private Function<? super R, DomainEvent> event;
        private final List<Repopulation<R>> repopulations = new ArrayList<>();

        private Builder(Supplier<R> write) {
            this.write = Objects.requireNonNull(write, "write");
        }

        public Builder<R> invalidate(CacheKey... keys) {
            return invalidate(Arrays.asList(keys));
        }

        public Builder<R> invalidate(Collection<CacheKey> keys) {
            invalidations.addAll(keys);
            return this;
        }

        public Builder<R> publish(Function<? super R, DomainEvent> event) {
            this.event = event;
            return this;
        }

        /**
         * Refills the key with the write result once the event is out.
         */
        public Builder<R> repopulate(CacheKey key) {
            return repopulate(key, Function.identity());
        }

        public Builder<R> repopulate(CacheKey key, Function<? super R, ?> value) {
            repopulations.add(new Repopulation<>(key, value));
            return this;
        }

        public CacheMutation<R> build() {
            Objects.requireNonNull(event, "every mutation publishes exactly one event");
            return new CacheMutation<>(this);
        }
    }
}
