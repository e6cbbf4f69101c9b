package com.dealengine.evidence;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Write-once snapshot backing an activation decision.
 *
 * The key is {@code evidence:<sha256 of canonicalForm>}, so storing the same
 * content twice yields the same record. Columns are not updatable.
 */
@Entity
@Table(name = "evidence_records", indexes = {
    @Index(name = "idx_evidence_activation_key", columnList = "activation_key"),
    @Index(name = "idx_evidence_stored_at", columnList = "stored_at")
})
@Data
@NoArgsConstructor
public class EvidenceRecord {

    @Id
    @Column(updatable = false)
    private String evidenceKey;

    @Column(length = 64, nullable = false, unique = true, updatable = false)
    private String evidenceHash;

    @Column(name = "activation_key", nullable = false, updatable = false)
    private String activationKey;

    @Column(nullable = false, updatable = false)
    private String kind;

    @Lob
    @Column(nullable = false, updatable = false)
    private String canonicalForm;

    @Column(updatable = false)
    private int sizeBytes;

    @Column(updatable = false)
    private String storedBy;

    @Column(name = "stored_at", updatable = false)
    private Instant storedAt;

    public EvidenceRecord(String evidenceKey, String evidenceHash, String activationKey, String kind,
                          String canonicalForm, int sizeBytes, String storedBy) {
        this.evidenceKey = evidenceKey;
        this.evidenceHash = evidenceHash;
        this.activationKey = activationKey;
        this.kind = kind;
        this.canonicalForm = canonicalForm;
        this.sizeBytes = sizeBytes;
        this.storedBy = storedBy;
        this.storedAt = Instant.now();
    }
}
