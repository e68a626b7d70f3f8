package com.homestead.household.domain.exception;

/**
 * A request broke a domain rule. Raised before any cache key or row is touched.
 */
public class BusinessRuleException extends HouseholdException {

    public BusinessRuleException(String message) {
        super(message);
    }
}
