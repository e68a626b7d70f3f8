package com.homestead.household.domain.model;

import java.time.Instant;

public record User(
        Long id,
        String email,
        String name,
        String avatar,
        Instant createdAt
) {}
