package com.dealengine.notification;

import com.dealengine.activation.Activation;
import com.dealengine.common.IdempotencyKeys;
import lombok.Value;

import java.time.Instant;

/**
 * Published exactly once per activation, after the activation row is committed.
 *
 * The notification service listens for this event and performs its own
 * deduplication per recipient and channel using {@link #notificationKey}.
 */
@Value
public class ActivationEvent {
    String dealId;
    String gameId;
    String activationKey;
    Instant triggeredAt;
    Instant expiresAt;

    public static ActivationEvent from(Activation activation) {
        return new ActivationEvent(
            activation.getDealId(),
            activation.getGameId(),
            activation.getActivationKey(),
            activation.getTriggeredAt(),
            activation.getExpiresAt()
        );
    }

    public String notificationKey(String recipientId, String channel) {
        return IdempotencyKeys.notificationKey(activationKey, recipientId, channel);
    }
}
