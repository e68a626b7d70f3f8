package com.homestead.household.domain.event;

/**
 * Entity family a {@link DomainEvent} refers to. Subscribers filter on it client-side.
 */
public enum Module {
    HOME,
    TASK,
    BILL,
    BILL_CATEGORY,
    POLL,
    ROOM,
    USER,
    NOTIFICATION,
    HOME_NOTIFICATION,
    SHOPPING_CATEGORY,
    SHOPPING_ITEM
}
