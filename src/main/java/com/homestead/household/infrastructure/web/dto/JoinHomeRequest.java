package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinHomeRequest(
        @NotBlank String inviteCode
) {}
