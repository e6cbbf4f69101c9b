package com.dealengine.activation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for activation persistence.
 */
@Repository
public interface ActivationRepository extends JpaRepository<Activation, String> {

    Optional<Activation> findByActivationKey(String activationKey);

    Optional<Activation> findByDealIdAndGameId(String dealId, String gameId);

    List<Activation> findByGameId(String gameId);

    List<Activation> findByStatusAndExpiresAtGreaterThanEqual(ActivationStatus status, Instant now);

    List<Activation> findByStatusAndExpiresAtBefore(ActivationStatus status, Instant now);
}
