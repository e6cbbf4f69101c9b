package com.dealengine.common.exception;

/**
 * Base exception for all deal engine exceptions.
 */
public class DealEngineException extends RuntimeException {

    public DealEngineException(String message) {
        super(message);
    }

    public DealEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
