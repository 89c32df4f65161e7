package com.flagship.iam_service.eventsourcing.model;

import lombok.Getter;

import java.util.UUID;

/**
 * No events are stored for the requested aggregate id.
 */
@Getter
public class AggregateNotFoundException extends RuntimeException {

    private final UUID aggregateId;

    public AggregateNotFoundException(UUID aggregateId) {
        super("Aggregate not found: " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public AggregateNotFoundException(UUID aggregateId, Class<?> expectedType) {
        super(String.format("%s not found: %s", expectedType.getSimpleName(), aggregateId));
        this.aggregateId = aggregateId;
    }
}
