package com.homestead.household.domain.model;

import java.time.Instant;

public record HomeNotification(
        Long id,
        Long fromUserId,
        Long homeId,
        String description,
        boolean read,
        Instant createdAt
) {}
