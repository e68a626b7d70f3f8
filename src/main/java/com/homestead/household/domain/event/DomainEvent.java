package com.homestead.household.domain.event;

import java.util.Map;
import java.util.Objects;

/**
 * Envelope broadcast after a successful write.
 * {@code data} is a snapshot of the affected entity, or a small identifier map for deletions.
 * Events are transient: published once, never stored.
 */
public record DomainEvent(
        Module module,
        Action action,
        Object data
) {
    public DomainEvent {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(action, "action");
    }

    public static DomainEvent of(Module module, Action action, Object data) {
        return new DomainEvent(module, action, data);
    }

    public static DomainEvent deleted(Module module, long id) {
        return new DomainEvent(module, Action.DELETED, Map.of("id", id));
    }
}
