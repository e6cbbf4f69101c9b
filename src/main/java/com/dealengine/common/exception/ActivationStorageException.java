package com.dealengine.common.exception;

/**
 * Thrown when the activation store fails permanently.
 *
 * A lost activation means a deal that should go live never does, so this
 * exception is always propagated to the caller.
 */
public class ActivationStorageException extends DealEngineException {

    private final String activationKey;

    public ActivationStorageException(String activationKey, Throwable cause) {
        super("Activation store failed for key " + activationKey + ": " + cause.getMessage(), cause);
        this.activationKey = activationKey;
    }

    public String getActivationKey() {
        return activationKey;
    }
}
