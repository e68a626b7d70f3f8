package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
        @Size(max = 255) String name,
        String avatar
) {}
