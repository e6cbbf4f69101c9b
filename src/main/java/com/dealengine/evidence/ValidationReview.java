package com.dealengine.evidence;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A reviewer's recorded verdict on an activation. Append-only.
 */
@Entity
@Table(name = "validation_reviews", indexes = {
    @Index(name = "idx_review_activation_key", columnList = "activation_key")
})
@Data
@NoArgsConstructor
public class ValidationReview {

    @Id
    private String reviewId;

    @Column(name = "activation_key", nullable = false)
    private String activationKey;

    private String reviewerId;

    @Enumerated(EnumType.STRING)
    private ReviewOutcome outcome;

    @Column(length = 1000)
    private String notes;

    private Instant reviewedAt;

    public ValidationReview(String activationKey, String reviewerId, ReviewOutcome outcome, String notes) {
        this.reviewId = UUID.randomUUID().toString();
        this.activationKey = activationKey;
        this.reviewerId = reviewerId;
        this.outcome = outcome;
        this.notes = notes;
        this.reviewedAt = Instant.now();
    }
}
