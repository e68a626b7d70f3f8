package com.homestead.household.domain.model;

import java.time.Instant;

public record ShoppingItem(
        Long id,
        Long categoryId,
        String name,
        Long uploadedBy,
        boolean bought,
        String image,
        String link,
        Instant boughtDate,
        Instant createdAt
) {}
