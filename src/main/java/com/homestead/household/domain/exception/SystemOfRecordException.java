package com.homestead.household.domain.exception;

/**
 * The authoritative store failed or refused a read or write.
 * This is the only failure of a cached operation that reaches the caller.
 */
public class SystemOfRecordException extends HouseholdException {

    public SystemOfRecordException(String message) {
        super(message);
    }

    public SystemOfRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
