package com.homestead.household.domain.event;

/**
 * Lifecycle verb of a {@link DomainEvent}.
 */
public enum Action {
    CREATED,
    UPDATED,
    DELETED,
    MARKED_PAYED,
    CLOSED,
    VOTED,
    UNVOTED,
    MEMBER_JOINED,
    MEMBER_LEFT,
    MEMBER_REMOVED,
    ASSIGNED,
    COMPLETED,
    UNCOMPLETED,
    MARK_READ
}
