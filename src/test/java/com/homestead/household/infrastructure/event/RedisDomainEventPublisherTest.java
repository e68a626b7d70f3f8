package com.homestead.household.infrastructure.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.model.Bill;
import com.homestead.household.support.CacheFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisDomainEventPublisherTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    private final ObjectMapper objectMapper = CacheFixtures.objectMapper();
    private EventProperties properties;
    private RedisDomainEventPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = new EventProperties();
        publisher = new RedisDomainEventPublisher(redisTemplate, objectMapper, properties);
    }

    @Test
    void shouldPublishEnvelopeOnUpdatesChannel() throws Exception {
        // Given
        Bill bill = new Bill(42L, 7L, null, "electricity", true, Instant.parse("2025-02-01T10:00:00Z"),
                new BigDecimal("120.50"), LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), 2L, null,
                Instant.parse("2025-01-31T09:00:00Z"));

        // When
        publisher.publish(DomainEvent.of(Module.BILL, Action.MARKED_PAYED, bill));

        // Then
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("updates"), message.capture());

        JsonNode envelope = objectMapper.readTree(message.getValue());
        assertThat(envelope.get("module").asText()).isEqualTo("BILL");
        assertThat(envelope.get("action").asText()).isEqualTo("MARKED_PAYED");
        assertThat(envelope.get("data").get("id").asLong()).isEqualTo(42L);
        assertThat(envelope.get("data").get("payed").asBoolean()).isTrue();
    }

    @Test
    void shouldPublishIdentifierMapForDeletions() throws Exception {
        // When
        publisher.publish(DomainEvent.deleted(Module.TASK, 10));

        // Then
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("updates"), message.capture());
        assertThat(objectMapper.readTree(message.getValue()).get("data").get("id").asLong()).isEqualTo(10L);
    }

    @Test
    void shouldUseConfiguredChannel() {
        properties.setChannel("household-updates");

        publisher.publish(DomainEvent.deleted(Module.ROOM, 4));

        verify(redisTemplate).convertAndSend(eq("household-updates"), anyString());
    }

    @Test
    void shouldSwallowBrokerFailures() {
        // Given
        when(redisTemplate.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // When & Then
        assertThatCode(() -> publisher.publish(DomainEvent.deleted(Module.ROOM, 4)))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldSkipPublishingWhenDisabled() {
        properties.setEnabled(false);

        publisher.publish(DomainEvent.deleted(Module.ROOM, 4));

        verifyNoInteractions(redisTemplate);
    }
}
