package com.dealengine.evidence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for evidence records.
 */
@Repository
public interface EvidenceRepository extends JpaRepository<EvidenceRecord, String> {

    Optional<EvidenceRecord> findByEvidenceKey(String evidenceKey);

    List<EvidenceRecord> findByActivationKeyOrderByStoredAtAsc(String activationKey);
}
