package com.dealengine.activation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, race-safe record of activations.
 *
 * The only mutation paths are {@link #tryActivate} and {@link #transition}; both
 * are atomic with respect to concurrent callers. Implementations are Spring beans
 * whose lifetime is owned by the application context.
 */
public interface ActivationStore {

    /**
     * Insert a TRIGGERED activation unless one already exists for the key or for
     * the (dealId, gameId) pair. Returns the existing row with {@code created=false}
     * otherwise. Safe to retry with the same key after any failure.
     */
    ActivationResult tryActivate(String activationKey, String dealId, String gameId,
                                 Instant now, Duration ttl, String triggeredBy);

    /**
     * Apply one lifecycle transition atomically.
     *
     * @throws com.dealengine.common.exception.ActivationNotFoundException if no row has the key
     * @throws com.dealengine.common.exception.InvalidActivationStateException if the move is not allowed
     */
    Activation transition(String activationKey, ActivationStatus target, Instant now,
                          String actor, String reason);

    Optional<Activation> findByKey(String activationKey);

    Optional<Activation> findByDealAndGame(String dealId, String gameId);

    List<Activation> findByGame(String gameId);

    /**
     * TRIGGERED activations whose window has not passed at {@code now}.
     */
    List<Activation> findActive(Instant now);

    /**
     * TRIGGERED activations whose window has passed at {@code now}.
     */
    List<Activation> findDueForExpiry(Instant now);

    /**
     * Remove every activation. Intended for tests and local resets only.
     */
    void reset();
}
