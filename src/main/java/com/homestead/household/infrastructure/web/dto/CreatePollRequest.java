package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.time.Instant;
import java.util.List;

public record CreatePollRequest(
        @NotBlank String question,
        @NotBlank String type,
        @NotEmpty List<@NotBlank String> options,
        boolean allowRevote,
        Instant endsAt
) {}
