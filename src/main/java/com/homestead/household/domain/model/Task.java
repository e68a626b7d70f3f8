package com.homestead.household.domain.model;

import java.time.Instant;

public record Task(
        Long id,
        Long homeId,
        Long roomId,
        String name,
        String description,
        String scheduleType,
        Instant createdAt
) {}
