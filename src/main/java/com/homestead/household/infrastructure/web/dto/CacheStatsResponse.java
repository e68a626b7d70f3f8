package com.homestead.household.infrastructure.web.dto;

import com.homestead.household.infrastructure.cache.CacheStats;

public record CacheStatsResponse(
        long hits,
        long misses,
        long errors,
        long writes,
        long invalidations,
        double hitRatio,
        boolean healthy
) {
    public static CacheStatsResponse from(CacheStats stats) {
        return new CacheStatsResponse(stats.hits(), stats.misses(), stats.errors(), stats.writes(),
                stats.invalidations(), stats.hitRatio(), stats.isHealthy());
    }
}
