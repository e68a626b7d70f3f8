package com.homestead.household.domain.port.out;

import com.homestead.household.domain.event.DomainEvent;

/**
 * Broadcasts domain events to live clients.
 * Fire-and-forget: no acknowledgment, no delivery guarantee, never throws.
 */
public interface DomainEventPublisher {

    void publish(DomainEvent event);
}
