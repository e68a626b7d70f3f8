package com.homestead.household.infrastructure.cache;

import com.homestead.household.infrastructure.event.EventProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig
@ContextConfiguration(initializers = ConfigDataApplicationContextInitializer.class)
@EnableConfigurationProperties({CacheProperties.class, EventProperties.class})
@TestPropertySource(properties = {
        "household.cache.ttl-seconds=120",
        "household.cache.enabled=false",
        "household.events.channel=test-updates",
        "household.events.enabled=false"
})
class CachePropertiesTest {

    @Autowired
    private CacheProperties cacheProperties;

    @Autowired
    private EventProperties eventProperties;

    @Test
    void shouldBindConfigurationProperties() {
        assertThat(cacheProperties.getTtlSeconds()).isEqualTo(120);
        assertThat(cacheProperties.getTtl()).isEqualTo(Duration.ofMinutes(2));
        assertThat(cacheProperties.isEnabled()).isFalse();
        assertThat(eventProperties.getChannel()).isEqualTo("test-updates");
        assertThat(eventProperties.isEnabled()).isFalse();
    }

    @Test
    void shouldDefaultToOneHourTtlAndUpdatesChannel() {
        CacheProperties defaults = new CacheProperties();
        EventProperties eventDefaults = new EventProperties();

        assertThat(defaults.getTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(defaults.isEnabled()).isTrue();
        assertThat(eventDefaults.getChannel()).isEqualTo("updates");
        assertThat(eventDefaults.isEnabled()).isTrue();
    }
}
