package com.homestead.household.domain.model;

import java.time.Instant;

public record BillCategory(
        Long id,
        Long homeId,
        String name,
        String color,
        Instant createdAt
) {
    public static final String DEFAULT_COLOR = "#FBEB9E";
}
