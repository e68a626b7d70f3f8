package com.homestead.household.domain.model;

import java.time.Instant;

public record HomeMembership(
        Long id,
        Long homeId,
        Long userId,
        String role,
        Instant joinedAt
) {
    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_MEMBER = "member";
}
