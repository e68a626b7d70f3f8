package com.homestead.household.infrastructure.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Cache settings bound from {@code household.cache.*}.
 */
@Component
@ConfigurationProperties(prefix = "household.cache")
public class CacheProperties {

    private long ttlSeconds = 3600;
    private boolean enabled = true;

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTtl() {
        return Duration.ofSeconds(ttlSeconds);
    }
}
