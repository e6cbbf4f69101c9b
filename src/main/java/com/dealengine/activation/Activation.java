package com.dealengine.activation;

import com.dealengine.common.exception.InvalidActivationStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * Record that a deal went live because of a game.
 *
 * At most one row exists per (dealId, gameId); the activation key is the primary
 * key and both are backed by unique constraints. Status only changes through
 * {@link #transitionTo}, which enforces the lifecycle in {@link ActivationStatus}.
 */
@Entity
@Table(name = "activations",
    uniqueConstraints = @UniqueConstraint(name = "uk_activation_deal_game", columnNames = {"deal_id", "game_id"}),
    indexes = {
        @Index(name = "idx_activation_status_expires", columnList = "status, expires_at"),
        @Index(name = "idx_activation_game_id", columnList = "game_id")
    })
@Data
@NoArgsConstructor
public class Activation {

    @Id
    private String activationKey;

    @Column(name = "deal_id", nullable = false)
    private String dealId;

    @Column(name = "game_id", nullable = false)
    private String gameId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private ActivationStatus status;

    @Column(name = "triggered_at")
    @Setter(AccessLevel.NONE)
    private Instant triggeredAt;

    @Column(name = "expires_at")
    @Setter(AccessLevel.NONE)
    private Instant expiresAt;

    /**
     * Principal that caused the activation; the system principal for evaluated triggers.
     */
    private String triggeredBy;

    private Instant reversedAt;

    private String reversedBy;

    private String reversalReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Setter(AccessLevel.NONE)
    private Long version;

    public static Activation pending(String activationKey, String dealId, String gameId) {
        Activation activation = new Activation();
        activation.activationKey = activationKey;
        activation.dealId = dealId;
        activation.gameId = gameId;
        activation.status = ActivationStatus.PENDING;
        return activation;
    }

    /**
     * Move to {@code target}, stamping the fields that belong to it.
     *
     * @throws InvalidActivationStateException if the lifecycle does not allow the move
     */
    public void transitionTo(ActivationStatus target, Instant now, String actor, String reason) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidActivationStateException(activationKey, status.name(), target.name());
        }
        switch (target) {
            case TRIGGERED:
                throw new IllegalArgumentException("Use trigger() to activate " + activationKey);
            case EXPIRED:
                if (!isPastExpiry(now)) {
                    throw new InvalidActivationStateException(activationKey, status.name(), target.name());
                }
                break;
            case REVERSED:
                this.reversedAt = now;
                this.reversedBy = actor;
                this.reversalReason = reason;
                break;
            default:
                break;
        }
        this.status = target;
        this.updatedAt = now;
    }

    /**
     * PENDING -> TRIGGERED with a redemption window of {@code ttl}.
     */
    public void trigger(Instant now, Duration ttl, String actor) {
        if (!status.canTransitionTo(ActivationStatus.TRIGGERED)) {
            throw new InvalidActivationStateException(activationKey, status.name(), ActivationStatus.TRIGGERED.name());
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Activation TTL must be positive: " + ttl);
        }
        this.status = ActivationStatus.TRIGGERED;
        this.triggeredAt = now;
        this.expiresAt = now.plus(ttl);
        this.triggeredBy = actor;
        this.updatedAt = now;
    }

    public boolean isPastExpiry(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Triggered and still inside its redemption window.
     */
    public boolean isActiveAt(Instant now) {
        return status == ActivationStatus.TRIGGERED && !isPastExpiry(now);
    }

    public Activation copy() {
        Activation copy = new Activation();
        copy.activationKey = activationKey;
        copy.dealId = dealId;
        copy.gameId = gameId;
        copy.status = status;
        copy.triggeredAt = triggeredAt;
        copy.expiresAt = expiresAt;
        copy.triggeredBy = triggeredBy;
        copy.reversedAt = reversedAt;
        copy.reversedBy = reversedBy;
        copy.reversalReason = reversalReason;
        copy.updatedAt = updatedAt;
        copy.version = version;
        return copy;
    }
}
