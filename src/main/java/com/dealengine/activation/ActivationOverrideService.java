package com.dealengine.activation;

import com.dealengine.common.IdempotencyKeys;
import com.dealengine.common.exception.DealNotFoundException;
import com.dealengine.condition.Condition;
import com.dealengine.condition.ConditionCache;
import com.dealengine.deal.Deal;
import com.dealengine.deal.DealRepository;
import com.dealengine.evidence.EvidenceService;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Permission-gated entry points for people acting on activations.
 *
 * Every method checks the caller's permission before looking anything up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivationOverrideService {

    private final ActivationService activationService;
    private final DealRepository dealRepository;
    private final ConditionCache conditionCache;
    private final EvidenceService evidenceService;
    private final AccessGuard accessGuard;

    public Activation get(PrincipalBinding principal, String activationKey) {
        accessGuard.require(principal, Permission.READ_PROMOTIONS, activationKey);
        return activationService.getActivation(activationKey);
    }

    public List<Activation> listActive(PrincipalBinding principal) {
        accessGuard.require(principal, Permission.READ_PROMOTIONS, "activations:active");
        return activationService.findActive();
    }

    public List<Activation> listForGame(PrincipalBinding principal, String gameId) {
        accessGuard.require(principal, Permission.READ_PROMOTIONS, "game:" + gameId);
        return activationService.findByGame(gameId);
    }

    public ActivationStatus statusOf(PrincipalBinding principal, String dealId, String gameId) {
        accessGuard.require(principal, Permission.READ_PROMOTIONS, "deal:" + dealId + "/game:" + gameId);
        return activationService.statusOf(dealId, gameId);
    }

    /**
     * Withdraw a triggered activation.
     *
     * @throws com.dealengine.common.exception.PermissionDeniedException without OVERRIDE_VALIDATION
     * @throws com.dealengine.common.exception.InvalidActivationStateException unless TRIGGERED
     */
    public Activation reverse(PrincipalBinding principal, String activationKey, String reason) {
        accessGuard.require(principal, Permission.OVERRIDE_VALIDATION, activationKey);
        requireReason(reason);

        Activation reversed = activationService.reverse(activationKey, principal.getPrincipalId(), reason);
        evidenceService.recordOverride(principal, reversed, EvidenceService.KIND_REVERSAL, reason);

        log.info("Activation {} REVERSED by {}: {}", activationKey, principal.getPrincipalId(), reason);
        return reversed;
    }

    /**
     * Trigger a deal for a game regardless of its condition. Uses the same key as
     * automatic evaluation, so a forced trigger and an automatic one cannot both happen.
     *
     * @throws DealNotFoundException if the deal is unknown
     */
    public ActivationResult forceTrigger(PrincipalBinding principal, String dealId, String gameId, String reason) {
        accessGuard.require(principal, Permission.OVERRIDE_VALIDATION, "deal:" + dealId + "/game:" + gameId);
        requireReason(reason);

        Deal deal = dealRepository.findByDealId(dealId)
            .orElseThrow(() -> new DealNotFoundException(dealId));
        if (deal.getConditionString() == null || deal.getConditionString().isBlank()) {
            throw new IllegalArgumentException("Deal " + dealId + " has no trigger condition");
        }
        Condition condition = conditionCache.compile(deal.getConditionString());
        String key = IdempotencyKeys.keyFor(dealId, gameId, condition.getSignature());

        ActivationResult result = activationService.activate(key, dealId, gameId,
            deal.getActivationWindow().orElse(null), principal.getPrincipalId());
        if (result.isCreated()) {
            evidenceService.recordOverride(principal, result.getActivation(), EvidenceService.KIND_FORCE_TRIGGER, reason);
            log.warn("Deal {} FORCE-TRIGGERED for game {} by {}: {}", dealId, gameId, principal.getPrincipalId(), reason);
        }
        return result;
    }

    private static void requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required for manual overrides");
        }
    }
}
