package com.homestead.household.domain.exception;

public class InvalidStateTransitionException extends SystemOfRecordException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
