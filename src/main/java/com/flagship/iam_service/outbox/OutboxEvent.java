package com.flagship.iam_service.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox row.
 *
 * An outbox event stages one externally-notifiable domain event for
 * publication. It is written in the same transaction as the event-store
 * append, then picked up by a publishing worker outside this service.
 *
 * Key properties:
 * - Immutable value object
 * - state holds the transcoded domain event, without its aggregate id
 * - Only the publishing worker flips processed to true
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID aggregateId;
    String topic;           // topic of the domain event type
    byte[] state;           // transcoded event fields
    boolean processed;
    Instant createdAt;

    /**
     * Creates a new unprocessed outbox event.
     */
    public static OutboxEvent create(UUID aggregateId, String topic, byte[] state) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateId,
            topic,
            state,
            false,
            Instant.now()
        );
    }
}
