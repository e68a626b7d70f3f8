package com.homestead.household.domain.model;

import java.time.Instant;
import java.util.List;

public record Home(
        Long id,
        String name,
        String inviteCode,
        Instant createdAt,
        List<HomeMembership> memberships
) {
    public Home {
        memberships = memberships == null ? List.of() : List.copyOf(memberships);
    }

    public List<Long> memberIds() {
        return memberships.stream()
                .map(HomeMembership::userId)
                .toList();
    }
}
