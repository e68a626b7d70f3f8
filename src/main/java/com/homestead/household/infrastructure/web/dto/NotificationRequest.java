package com.homestead.household.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code toUserId} is required for user notifications and ignored for home-wide ones.
 */
public record NotificationRequest(
        Long toUserId,
        @NotBlank String description
) {}
