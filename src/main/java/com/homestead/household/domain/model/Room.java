package com.homestead.household.domain.model;

import java.time.Instant;

public record Room(
        Long id,
        Long homeId,
        String name,
        Instant createdAt
) {}
