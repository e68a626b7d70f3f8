package com.homestead.household.domain.exception;

public abstract class HouseholdException extends RuntimeException {

    protected HouseholdException(String message) {
        super(message);
    }

    protected HouseholdException(String message, Throwable cause) {
        super(message, cause);
    }
}
