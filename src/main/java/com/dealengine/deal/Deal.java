package com.dealengine.deal;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A restaurant promotion governed by a trigger condition.
 *
 * The approval workflow owns the lifecycle of this record; the deal engine
 * only reads published deals.
 */
@Entity
@Table(name = "deals", indexes = {
    @Index(name = "idx_deals_team_status", columnList = "team_id, status")
})
@Data
@NoArgsConstructor
public class Deal {

    @Id
    private String dealId;

    private String restaurantId;

    @Column(name = "team_id")
    private String teamId;

    private String title;

    /**
     * Authored trigger condition, e.g. "home win and 6+ runs".
     */
    @Column(length = 200)
    private String conditionString;

    @Enumerated(EnumType.STRING)
    private DealStatus status;

    /**
     * How long an activation stays redeemable. Falls back to the configured default when null.
     */
    private Long activationWindowMinutes;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Deal(String dealId, String restaurantId, String teamId, String title,
                String conditionString, DealStatus status) {
        this.dealId = dealId;
        this.restaurantId = restaurantId;
        this.teamId = teamId;
        this.title = title;
        this.conditionString = conditionString;
        this.status = status;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean isPublished() {
        return status == DealStatus.PUBLISHED;
    }

    public Optional<Duration> getActivationWindow() {
        return activationWindowMinutes == null || activationWindowMinutes <= 0
            ? Optional.empty()
            : Optional.of(Duration.ofMinutes(activationWindowMinutes));
    }
}
