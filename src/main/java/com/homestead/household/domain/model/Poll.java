package com.homestead.household.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;

public record Poll(
        Long id,
        Long homeId,
        String question,
        String type,
        PollStatus status,
        boolean allowRevote,
        Instant endsAt,
        Instant createdAt,
        List<PollOption> options
) {
    public Poll {
        options = options == null ? List.of() : List.copyOf(options);
    }

    @JsonIgnore
    public boolean isClosed() {
        return status == PollStatus.CLOSED;
    }
}
