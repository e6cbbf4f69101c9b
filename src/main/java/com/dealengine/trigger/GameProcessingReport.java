package com.dealengine.trigger;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-deal outcomes of processing one game fact.
 */
@Value
public class GameProcessingReport {
    String gameId;
    String teamId;
    List<DealEvaluation> evaluations;

    public GameProcessingReport(String gameId, String teamId, List<DealEvaluation> evaluations) {
        this.gameId = gameId;
        this.teamId = teamId;
        this.evaluations = List.copyOf(evaluations);
    }

    public long count(DealOutcome outcome) {
        return evaluations.stream().filter(e -> e.getOutcome() == outcome).count();
    }

    public List<String> triggeredDealIds() {
        return evaluations.stream()
            .filter(e -> e.getOutcome() == DealOutcome.TRIGGERED)
            .map(DealEvaluation::getDealId)
            .collect(Collectors.toList());
    }
}
