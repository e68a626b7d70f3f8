package com.homestead.household.domain.model;

import java.util.List;

public record PollOption(
        Long id,
        Long pollId,
        String title,
        List<Vote> votes
) {
    public PollOption {
        votes = votes == null ? List.of() : List.copyOf(votes);
    }
}
