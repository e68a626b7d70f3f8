package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.Size;

public record ShoppingCategoryRequest(
        @Size(max = 255) String name,
        String icon,
        String color
) {}
