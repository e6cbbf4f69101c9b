package com.dealengine.activation;

import com.dealengine.common.exception.ActivationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Activation store backed by the relational database.
 *
 * Insert-if-absent relies on the primary key and the (deal_id, game_id) unique
 * constraint: the first insert commits, every other insert fails with a
 * constraint violation and reads back the winner. Each write runs in its own
 * transaction so the activation is committed before the caller sees
 * {@code created=true}. Transitions are guarded by the entity's optimistic version.
 */
@Component
@ConditionalOnProperty(name = "deal-engine.activation.store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaActivationStore implements ActivationStore {

    private final ActivationRepository activationRepository;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public JpaActivationStore(ActivationRepository activationRepository,
                              PlatformTransactionManager transactionManager) {
        this.activationRepository = activationRepository;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public ActivationResult tryActivate(String activationKey, String dealId, String gameId,
                                        Instant now, Duration ttl, String triggeredBy) {
        Activation candidate = Activation.pending(activationKey, dealId, gameId);
        candidate.trigger(now, ttl, triggeredBy);

        try {
            Activation saved = writeTransaction.execute(status -> activationRepository.saveAndFlush(candidate));
            log.info("Inserted activation {} for deal {} game {}", activationKey, dealId, gameId);
            return ActivationResult.created(saved);
        } catch (DataIntegrityViolationException e) {
            Activation existing = readTransaction.execute(status -> findExisting(activationKey, dealId, gameId))
                .orElseThrow(() -> e);
            log.info("Activation for deal {} game {} already exists as {} ({})",
                dealId, gameId, existing.getActivationKey(), existing.getStatus());
            return ActivationResult.existing(existing);
        }
    }

    @Override
    public Activation transition(String activationKey, ActivationStatus target, Instant now,
                                 String actor, String reason) {
        return writeTransaction.execute(status -> {
            Activation activation = activationRepository.findByActivationKey(activationKey)
                .orElseThrow(() -> new ActivationNotFoundException(activationKey));
            ActivationStatus previous = activation.getStatus();
            activation.transitionTo(target, now, actor, reason);
            Activation saved = activationRepository.saveAndFlush(activation);
            log.info("Activation {} moved {} -> {} by {}", activationKey, previous, target, actor);
            return saved;
        });
    }

    @Override
    public Optional<Activation> findByKey(String activationKey) {
        return readTransaction.execute(status -> activationRepository.findByActivationKey(activationKey));
    }

    @Override
    public Optional<Activation> findByDealAndGame(String dealId, String gameId) {
        return readTransaction.execute(status -> activationRepository.findByDealIdAndGameId(dealId, gameId));
    }

    @Override
    public List<Activation> findByGame(String gameId) {
        return readTransaction.execute(status -> activationRepository.findByGameId(gameId));
    }

    @Override
    public List<Activation> findActive(Instant now) {
        return readTransaction.execute(status ->
            activationRepository.findByStatusAndExpiresAtGreaterThanEqual(ActivationStatus.TRIGGERED, now));
    }

    @Override
    public List<Activation> findDueForExpiry(Instant now) {
        return readTransaction.execute(status ->
            activationRepository.findByStatusAndExpiresAtBefore(ActivationStatus.TRIGGERED, now));
    }

    @Override
    public void reset() {
        writeTransaction.executeWithoutResult(status -> activationRepository.deleteAllInBatch());
        log.warn("Activation store reset");
    }

    private Optional<Activation> findExisting(String activationKey, String dealId, String gameId) {
        Optional<Activation> byKey = activationRepository.findByActivationKey(activationKey);
        if (byKey.isPresent()) {
            return byKey;
        }
        return activationRepository.findByDealIdAndGameId(dealId, gameId);
    }
}
