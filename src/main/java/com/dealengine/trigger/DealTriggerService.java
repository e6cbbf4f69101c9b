package com.dealengine.trigger;

import com.dealengine.activation.ActivationResult;
import com.dealengine.activation.ActivationService;
import com.dealengine.common.IdempotencyKeys;
import com.dealengine.common.exception.ConditionParseException;
import com.dealengine.common.exception.DealNotFoundException;
import com.dealengine.condition.Condition;
import com.dealengine.condition.ConditionCache;
import com.dealengine.condition.PredicateEvaluator;
import com.dealengine.deal.Deal;
import com.dealengine.deal.DealRepository;
import com.dealengine.evidence.EvidenceService;
import com.dealengine.game.GameFact;
import com.dealengine.security.PrincipalBinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates published deals against incoming game facts.
 *
 * Processing flow per deal:
 * 1. Compile the condition (memoized)
 * 2. Evaluate it against the fact
 * 3. On a match, derive the activation key and activate at most once
 * 4. Only the call that created the activation records trigger evidence
 *
 * Safe to call repeatedly and concurrently for the same fact. Storage failures
 * propagate; a bad condition on one deal does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DealTriggerService {

    private final DealRepository dealRepository;
    private final ConditionCache conditionCache;
    private final PredicateEvaluator evaluator;
    private final ActivationService activationService;
    private final EvidenceService evidenceService;

    public GameProcessingReport processGame(GameFact fact) {
        requireIdentity(fact);
        List<Deal> deals = dealRepository.findEvaluableByTeamId(fact.getTeamId());
        log.info("Processing game {} for team {}: {} evaluable deals (complete={})",
            fact.getGameId(), fact.getTeamId(), deals.size(), fact.isComplete());

        List<DealEvaluation> evaluations = new ArrayList<>();
        for (Deal deal : deals) {
            evaluations.add(evaluate(deal, fact));
        }

        GameProcessingReport report = new GameProcessingReport(fact.getGameId(), fact.getTeamId(), evaluations);
        log.info("Game {} processed: triggered={}, alreadyHandled={}, notMet={}, invalid={}",
            fact.getGameId(), report.count(DealOutcome.TRIGGERED), report.count(DealOutcome.ALREADY_HANDLED),
            report.count(DealOutcome.NOT_MET), report.count(DealOutcome.INVALID_CONDITION));
        return report;
    }

    /**
     * Evaluate a single deal, e.g. when a deal is published after its game finished.
     *
     * @throws DealNotFoundException if the deal is unknown
     */
    public DealEvaluation processDeal(String dealId, GameFact fact) {
        requireIdentity(fact);
        Deal deal = dealRepository.findByDealId(dealId)
            .orElseThrow(() -> new DealNotFoundException(dealId));
        if (!deal.isPublished() || !fact.getTeamId().equals(deal.getTeamId())
                || deal.getConditionString() == null || deal.getConditionString().isBlank()) {
            log.debug("Deal {} is not evaluable for game {} (status={}, team={})",
                dealId, fact.getGameId(), deal.getStatus(), deal.getTeamId());
            return DealEvaluation.of(dealId, DealOutcome.NOT_EVALUABLE);
        }
        return evaluate(deal, fact);
    }

    private DealEvaluation evaluate(Deal deal, GameFact fact) {
        Condition condition;
        try {
            condition = conditionCache.compile(deal.getConditionString());
        } catch (ConditionParseException e) {
            log.warn("Deal {} has an invalid condition '{}': {}", deal.getDealId(), deal.getConditionString(), e.getMessage());
            return new DealEvaluation(deal.getDealId(), DealOutcome.INVALID_CONDITION, null, e.getMessage());
        }

        boolean met = evaluator.evaluate(condition.getPredicate(), fact);
        log.debug("Deal {} condition '{}' on game {}: {}",
            deal.getDealId(), condition.getNormalizedSource(), fact.getGameId(), met);
        if (!met) {
            return DealEvaluation.of(deal.getDealId(), DealOutcome.NOT_MET);
        }

        String key = IdempotencyKeys.keyFor(deal.getDealId(), fact.getGameId(), condition.getSignature());
        ActivationResult result = activationService.activate(key, deal.getDealId(), fact.getGameId(),
            deal.getActivationWindow().orElse(null), PrincipalBinding.SYSTEM_PRINCIPAL_ID);

        if (!result.isCreated()) {
            return new DealEvaluation(deal.getDealId(), DealOutcome.ALREADY_HANDLED, key,
                result.getActivation().getStatus().name());
        }
        evidenceService.recordTrigger(result.getActivation(), condition, fact);
        return new DealEvaluation(deal.getDealId(), DealOutcome.TRIGGERED, key, null);
    }

    private static void requireIdentity(GameFact fact) {
        if (fact == null || fact.getGameId() == null || fact.getGameId().isBlank()
                || fact.getTeamId() == null || fact.getTeamId().isBlank()) {
            throw new IllegalArgumentException("Game fact needs a gameId and a teamId");
        }
    }
}
