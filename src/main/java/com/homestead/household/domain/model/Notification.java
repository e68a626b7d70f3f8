package com.homestead.household.domain.model;

import java.time.Instant;

public record Notification(
        Long id,
        Long fromUserId,
        Long toUserId,
        String description,
        boolean read,
        Instant createdAt
) {}
