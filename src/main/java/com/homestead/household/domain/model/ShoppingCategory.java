package com.homestead.household.domain.model;

import java.time.Instant;
import java.util.List;

public record ShoppingCategory(
        Long id,
        Long homeId,
        String name,
        String icon,
        String color,
        Instant createdAt,
        List<ShoppingItem> items
) {
    public static final String DEFAULT_COLOR = "#D8D4FC";

    public ShoppingCategory {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
