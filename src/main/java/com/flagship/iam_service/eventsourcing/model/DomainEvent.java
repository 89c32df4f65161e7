package com.flagship.iam_service.eventsourcing.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable fact recorded against an aggregate.
 *
 * Implementations are records: the mapper serializes the record components
 * and rebuilds the event from them when reading the log back.
 *
 * Propagation flags:
 * - externallyNotifiable: the unit of work stages one outbox row per event
 * - internallyNotifiable: the message bus feeds the event back to its own queue
 *
 * Both flags are properties of the event type, not of the stored payload.
 */
public interface DomainEvent extends Message {

    UUID id();

    int version();

    Instant timestamp();

    default boolean externallyNotifiable() {
        return false;
    }

    default boolean internallyNotifiable() {
        return false;
    }
}
