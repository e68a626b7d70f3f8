package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTaskRequest(
        @NotBlank @Size(max = 255) String name,
        String description,
        String scheduleType,
        Long roomId
) {}
