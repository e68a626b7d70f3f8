package com.homestead.household.infrastructure.cache.key;

import java.util.Objects;

/**
 * Identity of one cached value. Equal keys always render to the same string
 * and distinct keys never do.
 */
public record CacheKey(CacheKind kind, long id) {

    public CacheKey {
        Objects.requireNonNull(kind, "kind");
    }

    public static CacheKey of(CacheKind kind, long id) {
        return new CacheKey(kind, id);
    }

    public String value() {
        return kind.render(id);
    }

    @Override
    public String toString() {
        return value();
    }
}
