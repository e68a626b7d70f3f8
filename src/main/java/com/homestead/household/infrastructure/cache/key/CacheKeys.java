package com.homestead.household.infrastructure.cache.key;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static CacheKey home(long homeId) {
        return CacheKey.of(CacheKind.HOME, homeId);
    }

    public static CacheKey task(long taskId) {
        return CacheKey.of(CacheKind.TASK, taskId);
    }

    public static CacheKey tasksForHome(long homeId) {
        return CacheKey.of(CacheKind.TASKS_FOR_HOME, homeId);
    }

    public static CacheKey assignment(long assignmentId) {
        return CacheKey.of(CacheKind.ASSIGNMENT, assignmentId);
    }

    public static CacheKey assignmentsForUser(long userId) {
        return CacheKey.of(CacheKind.ASSIGNMENTS_FOR_USER, userId);
    }

    public static CacheKey closestAssignmentForUser(long userId) {
        return CacheKey.of(CacheKind.CLOSEST_ASSIGNMENT_FOR_USER, userId);
    }

    public static CacheKey room(long roomId) {
        return CacheKey.of(CacheKind.ROOM, roomId);
    }

    public static CacheKey roomsForHome(long homeId) {
        return CacheKey.of(CacheKind.ROOMS_FOR_HOME, homeId);
    }

    public static CacheKey bill(long billId) {
        return CacheKey.of(CacheKind.BILL, billId);
    }

    public static CacheKey billCategoriesForHome(long homeId) {
        return CacheKey.of(CacheKind.BILL_CATEGORIES_FOR_HOME, homeId);
    }

    public static CacheKey poll(long pollId) {
        return CacheKey.of(CacheKind.POLL, pollId);
    }

    public static CacheKey pollsForHome(long homeId) {
        return CacheKey.of(CacheKind.POLLS_FOR_HOME, homeId);
    }

    public static CacheKey shoppingCategory(long categoryId) {
        return CacheKey.of(CacheKind.SHOPPING_CATEGORY, categoryId);
    }

    public static CacheKey shoppingCategoriesForHome(long homeId) {
        return CacheKey.of(CacheKind.SHOPPING_CATEGORIES_FOR_HOME, homeId);
    }

    public static CacheKey notificationsForUser(long userId) {
        return CacheKey.of(CacheKind.NOTIFICATIONS_FOR_USER, userId);
    }

    public static CacheKey notificationsForHome(long homeId) {
        return CacheKey.of(CacheKind.NOTIFICATIONS_FOR_HOME, homeId);
    }
}
