package com.dealengine.common.exception;

/**
 * Thrown when a request carries no principal or one without a role binding.
 */
public class UnknownPrincipalException extends DealEngineException {

    public UnknownPrincipalException(String principalId) {
        super(principalId == null || principalId.isBlank()
            ? "Principal identification required"
            : "Unknown principal: " + principalId);
    }
}
