package com.dealengine.common.exception;

/**
 * Thrown when an activation is not found.
 */
public class ActivationNotFoundException extends DealEngineException {

    public ActivationNotFoundException(String activationKey) {
        super("Activation not found: " + activationKey);
    }
}
