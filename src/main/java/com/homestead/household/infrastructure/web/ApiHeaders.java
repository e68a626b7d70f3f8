package com.homestead.household.infrastructure.web;

final class ApiHeaders {

    /**
     * Id of the acting user, set by the authenticating gateway.
     */
    static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
