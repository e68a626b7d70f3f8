package com.homestead.household.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.time.LocalDate;

public record TaskAssignment(
        Long id,
        Long taskId,
        Long homeId,
        Long userId,
        AssignmentStatus status,
        LocalDate assignedDate,
        Instant completedAt
) {
    @JsonIgnore
    public boolean isCompleted() {
        return status == AssignmentStatus.COMPLETED;
    }
}
