package com.dealengine.trigger;

import lombok.Value;

/**
 * Outcome for one deal within a processed game.
 */
@Value
public class DealEvaluation {
    String dealId;
    DealOutcome outcome;
    String activationKey;
    String detail;

    public static DealEvaluation of(String dealId, DealOutcome outcome) {
        return new DealEvaluation(dealId, outcome, null, null);
    }
}
