package com.homestead.household.infrastructure.web;

import com.homestead.household.infrastructure.cache.CacheStats;
import com.homestead.household.infrastructure.cache.TypedCache;
import com.homestead.household.infrastructure.web.dto.CacheStatsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/internal/cache")
public class CacheStatsController {

    private static final Logger logger = LoggerFactory.getLogger(CacheStatsController.class);

    private final TypedCache typedCache;

    public CacheStatsController(TypedCache typedCache) {
        this.typedCache = typedCache;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatsResponse> stats() {
        CacheStats stats = typedCache.getStats();
        if (!stats.isHealthy()) {
            logger.warn("Cache is degraded. {}", stats.summary());
        }
        return ResponseEntity.ok(CacheStatsResponse.from(stats));
    }
}
