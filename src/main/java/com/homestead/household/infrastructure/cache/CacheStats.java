package com.homestead.household.infrastructure.cache;

/**
 * Counters kept by {@link TypedCache} since start-up.
 */
public record CacheStats(
        long hits,
        long misses,
        long errors,
        long writes,
        long invalidations
) {
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public boolean isHealthy() {
        long operations = hits + misses + writes + invalidations;
        return errors == 0 || errors < operations * 0.05;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, errors: %d, invalidations: %d",
                hitRatio() * 100, errors, invalidations);
    }
}
