package com.homestead.household.infrastructure.cache.key;

/**
 * Every kind of value the cache holds.
 * A kind renders as {@code segment:id} or, for lists and derived indexes, {@code segment:id:relation}.
 * No two kinds share the same (segment, relation) pair and neither part may contain {@code ':'}.
 */
public enum CacheKind {
    HOME("home", null),
    TASK("task", null),
    TASKS_FOR_HOME("home", "tasks"),
    ASSIGNMENT("assignment", null),
    ASSIGNMENTS_FOR_USER("user", "assignments"),
    CLOSEST_ASSIGNMENT_FOR_USER("user", "closest-assignment"),
    ROOM("room", null),
    ROOMS_FOR_HOME("home", "rooms"),
    BILL("bill", null),
    BILL_CATEGORIES_FOR_HOME("home", "bill-categories"),
    POLL("poll", null),
    POLLS_FOR_HOME("home", "polls"),
    SHOPPING_CATEGORY("shopping-category", null),
    SHOPPING_CATEGORIES_FOR_HOME("home", "shopping-categories"),
    NOTIFICATIONS_FOR_USER("user", "notifications"),
    NOTIFICATIONS_FOR_HOME("home", "notifications");

    private static final char SEPARATOR = ':';

    private final String segment;
    private final String relation;

    CacheKind(String segment, String relation) {
        this.segment = segment;
        this.relation = relation;
    }

    public String segment() {
        return segment;
    }

    public String relation() {
        return relation;
    }

    String render(long id) {
        StringBuilder key = new StringBuilder(segment).append(SEPARATOR).append(id);
        if (relation != null) {
            key.append(SEPARATOR).append(relation);
        }
        return key.toString();
    }
}
