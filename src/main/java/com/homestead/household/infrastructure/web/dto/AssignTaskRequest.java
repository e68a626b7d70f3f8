package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record AssignTaskRequest(
        @NotNull Long userId,
        @NotNull LocalDate date
) {}
