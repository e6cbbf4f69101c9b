package com.dealengine.trigger;

/**
 * Result of evaluating one deal against one game.
 */
public enum DealOutcome {
    /**
     * Condition held and this call created the activation.
     */
    TRIGGERED,

    /**
     * Condition held but the pair was already activated by an earlier or concurrent call.
     */
    ALREADY_HANDLED,

    NOT_MET,

    /**
     * The deal's condition does not parse; the deal is skipped.
     */
    INVALID_CONDITION,

    /**
     * The deal is not published, belongs to another team, or has no condition.
     */
    NOT_EVALUABLE
}
