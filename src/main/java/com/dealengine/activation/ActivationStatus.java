package com.dealengine.activation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an activation.
 *
 * PENDING -> TRIGGERED happens exactly once, when the activation row is inserted.
 * TRIGGERED -> EXPIRED once the redemption window has passed.
 * TRIGGERED -> REVERSED only through an authorized override.
 * EXPIRED and REVERSED are terminal.
 */
public enum ActivationStatus {
    /**
     * No activation has been recorded for the (deal, game) pair yet.
     */
    PENDING,

    /**
     * Deal is live for the game.
     */
    TRIGGERED,

    /**
     * Redemption window has passed. Kept for audit.
     */
    EXPIRED,

    /**
     * Withdrawn by an administrator.
     */
    REVERSED;

    public Set<ActivationStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(TRIGGERED);
            case TRIGGERED:
                return EnumSet.of(EXPIRED, REVERSED);
            default:
                return EnumSet.noneOf(ActivationStatus.class);
        }
    }

    public boolean canTransitionTo(ActivationStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
