package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Used for both create and partial update. Create additionally requires a name.
 */
public record BillCategoryRequest(
        @Size(max = 255) String name,
        @Pattern(regexp = "#[0-9A-Fa-f]{6}") String color
) {}
