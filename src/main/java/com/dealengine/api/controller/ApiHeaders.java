package com.dealengine.api.controller;

/**
 * Request headers shared by the REST controllers.
 */
public final class ApiHeaders {

    /**
     * Id of the already authenticated caller, set by the gateway.
     */
    public static final String PRINCIPAL_ID = "X-Principal-Id";

    private ApiHeaders() {
    }
}
