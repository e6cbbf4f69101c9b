package com.dealengine.activation;

import com.dealengine.common.exception.ActivationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Activation store held in process memory, for local runs and tests.
 *
 * The (dealId, gameId) pair is the atomic claim: {@link ConcurrentMap#putIfAbsent}
 * decides the single winner. Rows are copied on the way in and out, and
 * transitions replace a row through {@link ConcurrentMap#compute}, so callers
 * never share mutable state with the store.
 */
@Component
@ConditionalOnProperty(name = "deal-engine.activation.store", havingValue = "memory")
@Slf4j
public class InMemoryActivationStore implements ActivationStore {

    private final ConcurrentMap<String, Activation> byPair = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> pairByKey = new ConcurrentHashMap<>();

    @Override
    public ActivationResult tryActivate(String activationKey, String dealId, String gameId,
                                        Instant now, Duration ttl, String triggeredBy) {
        Activation candidate = Activation.pending(activationKey, dealId, gameId);
        candidate.trigger(now, ttl, triggeredBy);

        String pair = pairOf(dealId, gameId);
        String claimedPair = pairByKey.putIfAbsent(activationKey, pair);
        if (claimedPair != null && !claimedPair.equals(pair)) {
            throw new IllegalStateException("Activation key " + activationKey + " already belongs to " + claimedPair);
        }

        Activation existing = byPair.putIfAbsent(pair, candidate);
        if (existing != null) {
            log.info("Activation for deal {} game {} already exists as {} ({})",
                dealId, gameId, existing.getActivationKey(), existing.getStatus());
            return ActivationResult.existing(existing.copy());
        }
        log.info("Inserted activation {} for deal {} game {}", activationKey, dealId, gameId);
        return ActivationResult.created(candidate.copy());
    }

    @Override
    public Activation transition(String activationKey, ActivationStatus target, Instant now,
                                 String actor, String reason) {
        String pair = pairByKey.get(activationKey);
        if (pair == null || !byPair.containsKey(pair)) {
            throw new ActivationNotFoundException(activationKey);
        }
        Activation updated = byPair.compute(pair, (ignored, current) -> {
            if (current == null || !current.getActivationKey().equals(activationKey)) {
                throw new ActivationNotFoundException(activationKey);
            }
            Activation next = current.copy();
            next.transitionTo(target, now, actor, reason);
            return next;
        });
        log.info("Activation {} moved to {} by {}", activationKey, target, actor);
        return updated.copy();
    }

    @Override
    public Optional<Activation> findByKey(String activationKey) {
        String pair = pairByKey.get(activationKey);
        if (pair == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPair.get(pair))
            .filter(activation -> activation.getActivationKey().equals(activationKey))
            .map(Activation::copy);
    }

    @Override
    public Optional<Activation> findByDealAndGame(String dealId, String gameId) {
        return Optional.ofNullable(byPair.get(pairOf(dealId, gameId))).map(Activation::copy);
    }

    @Override
    public List<Activation> findByGame(String gameId) {
        return select(activation -> activation.getGameId().equals(gameId));
    }

    @Override
    public List<Activation> findActive(Instant now) {
        return select(activation -> activation.isActiveAt(now));
    }

    @Override
    public List<Activation> findDueForExpiry(Instant now) {
        return select(activation -> activation.getStatus() == ActivationStatus.TRIGGERED
            && activation.isPastExpiry(now));
    }

    @Override
    public void reset() {
        byPair.clear();
        pairByKey.clear();
        log.warn("Activation store reset");
    }

    private List<Activation> select(Predicate<Activation> filter) {
        return byPair.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(Activation::getTriggeredAt))
            .map(Activation::copy)
            .collect(Collectors.toList());
    }

    private static String pairOf(String dealId, String gameId) {
        return dealId.length() + "#" + dealId + "|" + gameId;
    }
}
