package com.homestead.household.infrastructure.web.dto;

/**
 * A {@code null} room takes the task out of any room.
 */
public record ReassignRoomRequest(
        Long roomId
) {}
