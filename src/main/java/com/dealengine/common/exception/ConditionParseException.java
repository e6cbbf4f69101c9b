package com.dealengine.common.exception;

/**
 * Thrown when a trigger condition cannot be compiled.
 */
public class ConditionParseException extends DealEngineException {

    private final String source;
    private final String offendingToken;

    public ConditionParseException(String source, String offendingToken, String detail) {
        super(String.format("Cannot parse condition '%s' at '%s': %s", source, offendingToken, detail));
        this.source = source;
        this.offendingToken = offendingToken;
    }

    public String getSource() {
        return source;
    }

    public String getOffendingToken() {
        return offendingToken;
    }
}
