package com.dealengine.common.exception;

/**
 * Thrown when a deal is not found.
 */
public class DealNotFoundException extends DealEngineException {

    public DealNotFoundException(String dealId) {
        super("Deal not found: " + dealId);
    }
}
