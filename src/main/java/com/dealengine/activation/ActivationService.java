package com.dealengine.activation;

import com.dealengine.common.IdempotencyKeys;
import com.dealengine.common.exception.ActivationNotFoundException;
import com.dealengine.common.exception.ActivationStorageException;
import com.dealengine.common.exception.InvalidActivationStateException;
import com.dealengine.notification.ActivationEvent;
import com.dealengine.security.PrincipalBinding;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Service for the activation lifecycle.
 *
 * Activation flow:
 * 1. Atomic insert-if-absent in the {@link ActivationStore}
 * 2. Transient store failures are retried with the identical key
 * 3. Only the caller that created the row publishes an {@link ActivationEvent}
 *
 * Expiry is applied lazily on every read and by {@link ActivationExpirySweeper}.
 * This service performs no permission checks; manual entry points go through
 * {@link ActivationOverrideService}.
 */
@Service
@Slf4j
public class ActivationService {

    private final ActivationStore activationStore;
    private final Retry activationStoreRetry;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration defaultTtl;

    public ActivationService(ActivationStore activationStore,
                             Retry activationStoreRetry,
                             ApplicationEventPublisher eventPublisher,
                             Clock clock,
                             @Value("${deal-engine.activation.default-ttl:PT24H}") Duration defaultTtl) {
        this.activationStore = activationStore;
        this.activationStoreRetry = activationStoreRetry;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    /**
     * Activate a deal for a game at most once.
     *
     * @param ttl redemption window, or null for the configured default
     * @return {@code created=true} for exactly one caller per (deal, game); everyone
     *         else receives the existing activation and must not act on it
     * @throws ActivationStorageException if the store fails permanently
     */
    public ActivationResult activate(String activationKey, String dealId, String gameId,
                                     Duration ttl, String triggeredBy) {
        IdempotencyKeys.validate(activationKey);
        Duration window = ttl != null ? ttl : defaultTtl;
        Instant now = clock.instant();

        ActivationResult result = withRetry(activationKey,
            () -> activationStore.tryActivate(activationKey, dealId, gameId, now, window, triggeredBy));

        if (result.isCreated()) {
            log.info("Deal {} TRIGGERED for game {} (key={}, expires={})",
                dealId, gameId, activationKey, result.getActivation().getExpiresAt());
            eventPublisher.publishEvent(ActivationEvent.from(result.getActivation()));
        } else {
            log.info("Deal {} for game {} already handled (key={}, status={})",
                dealId, gameId, result.getActivation().getActivationKey(), result.getActivation().getStatus());
        }
        return result;
    }

    public Optional<Activation> find(String activationKey) {
        Instant now = clock.instant();
        return withRetry(activationKey, () -> activationStore.findByKey(activationKey))
            .map(activation -> expireIfDue(activation, now));
    }

    public Activation getActivation(String activationKey) {
        return find(activationKey)
            .orElseThrow(() -> new ActivationNotFoundException(activationKey));
    }

    public Optional<Activation> findFor(String dealId, String gameId) {
        Instant now = clock.instant();
        return withRetry(dealId + "/" + gameId, () -> activationStore.findByDealAndGame(dealId, gameId))
            .map(activation -> expireIfDue(activation, now));
    }

    /**
     * Current lifecycle state of a (deal, game) pair; PENDING when nothing was recorded.
     */
    public ActivationStatus statusOf(String dealId, String gameId) {
        return findFor(dealId, gameId)
            .map(Activation::getStatus)
            .orElse(ActivationStatus.PENDING);
    }

    public List<Activation> findByGame(String gameId) {
        Instant now = clock.instant();
        return withRetry(gameId, () -> activationStore.findByGame(gameId)).stream()
            .map(activation -> expireIfDue(activation, now))
            .collect(Collectors.toList());
    }

    /**
     * Activations that are live right now. Expired rows are excluded but retained.
     */
    public List<Activation> findActive() {
        Instant now = clock.instant();
        return withRetry("active", () -> activationStore.findActive(now));
    }

    /**
     * TRIGGERED -> REVERSED. Callers must have checked the override permission.
     */
    public Activation reverse(String activationKey, String actor, String reason) {
        Activation current = getActivation(activationKey);
        if (!current.getStatus().canTransitionTo(ActivationStatus.REVERSED)) {
            throw new InvalidActivationStateException(activationKey,
                current.getStatus().name(), ActivationStatus.REVERSED.name());
        }
        Instant now = clock.instant();
        return withRetry(activationKey,
            () -> activationStore.transition(activationKey, ActivationStatus.REVERSED, now, actor, reason));
    }

    /**
     * Expire every TRIGGERED activation whose window has passed.
     *
     * @return number of activations moved to EXPIRED
     */
    public int expireDue() {
        Instant now = clock.instant();
        int expired = 0;
        for (Activation due : withRetry("sweep", () -> activationStore.findDueForExpiry(now))) {
            if (expireIfDue(due, now).getStatus() == ActivationStatus.EXPIRED) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} activations", expired);
        }
        return expired;
    }

    private Activation expireIfDue(Activation activation, Instant now) {
        if (activation.getStatus() != ActivationStatus.TRIGGERED || !activation.isPastExpiry(now)) {
            return activation;
        }
        String key = activation.getActivationKey();
        try {
            return withRetry(key, () -> activationStore.transition(
                key, ActivationStatus.EXPIRED, now, PrincipalBinding.SYSTEM_PRINCIPAL_ID, "redemption window elapsed"));
        } catch (InvalidActivationStateException e) {
            // Reversed or expired by another caller in the meantime
            log.debug("Activation {} changed state while expiring: {}", key, e.getMessage());
            return withRetry(key, () -> activationStore.findByKey(key)).orElse(activation);
        }
    }

    private <T> T withRetry(String key, Supplier<T> operation) {
        try {
            return Retry.decorateSupplier(activationStoreRetry, operation).get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Activation store failed for {} after retries", key, e);
            throw new ActivationStorageException(key, e);
        }
    }
}
