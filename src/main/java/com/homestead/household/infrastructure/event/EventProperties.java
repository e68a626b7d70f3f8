package com.homestead.household.infrastructure.event;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Real-time event settings bound from {@code household.events.*}.
 */
@Component
@ConfigurationProperties(prefix = "household.events")
public class EventProperties {

    private String channel = "updates";
    private boolean enabled = true;

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
