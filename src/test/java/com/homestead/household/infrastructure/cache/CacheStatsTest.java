package com.homestead.household.infrastructure.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStatsTest {

    @Test
    void shouldComputeHitRatio() {
        CacheStats stats = new CacheStats(3, 1, 0, 4, 2);

        assertThat(stats.hitRatio()).isEqualTo(0.75);
    }

    @Test
    void shouldBeHealthyWithoutTraffic() {
        CacheStats stats = new CacheStats(0, 0, 0, 0, 0);

        assertThat(stats.hitRatio()).isZero();
        assertThat(stats.isHealthy()).isTrue();
    }

    @Test
    void shouldBeUnhealthyWhenErrorsDominate() {
        CacheStats stats = new CacheStats(1, 1, 5, 0, 0);

        assertThat(stats.isHealthy()).isFalse();
    }
}
