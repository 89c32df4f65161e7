package com.flagship.iam_service.outbox;

import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import lombok.Value;

/**
 * An outbox row together with the domain event decoded from its state.
 */
@Value
public class OutboxMessage {
    OutboxEvent row;
    DomainEvent event;
}
