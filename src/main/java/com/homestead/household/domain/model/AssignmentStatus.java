package com.homestead.household.domain.model;

public enum AssignmentStatus {
    ASSIGNED,
    COMPLETED
}
