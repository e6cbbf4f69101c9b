package com.dealengine.common.exception;

/**
 * Thrown when attempting a transition that the activation lifecycle does not allow.
 */
public class InvalidActivationStateException extends DealEngineException {

    public InvalidActivationStateException(String activationKey, String currentState, String targetState) {
        super(String.format("Cannot move activation %s from %s to %s",
            activationKey, currentState, targetState));
    }
}
