package com.dealengine.evidence;

/**
 * Verdict a reviewer records against an activation.
 */
public enum ReviewOutcome {
    /**
     * Evidence supports the activation.
     */
    CONFIRMED,

    /**
     * Evidence contradicts the activation; an administrator should consider reversing it.
     */
    DISPUTED,

    /**
     * Evidence is inconclusive.
     */
    NEEDS_FOLLOW_UP
}
