package com.homestead.household.infrastructure.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.port.out.DomainEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes domain events as JSON on a single Redis Pub/Sub channel shared by all modules.
 * The real-time gateway subscribes to it; this side knows nothing about subscribers.
 */
@Component
public class RedisDomainEventPublisher implements DomainEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(RedisDomainEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final EventProperties properties;

    public RedisDomainEventPublisher(StringRedisTemplate redisTemplate,
                                     ObjectMapper objectMapper,
                                     EventProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void publish(DomainEvent event) {
        if (!properties.isEnabled()) {
            logger.debug("Event publishing disabled, dropping {} {}", event.module(), event.action());
            return;
        }

        try {
            String message = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(properties.getChannel(), message);
            logger.debug("Published {} {} on '{}'", event.module(), event.action(), properties.getChannel());
        } catch (Exception e) {
            logger.warn("Failed to publish {} {} event: {}", event.module(), event.action(), e.getMessage());
        }
    }
}
