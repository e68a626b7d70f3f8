package com.homestead.household.domain.model;

/**
 * Poll lifecycle. {@link #CLOSED} is terminal.
 */
public enum PollStatus {
    OPEN,
    CLOSED
}
