package com.flagship.iam_service.service.messagebus;

import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import lombok.Getter;

/**
 * Thrown by an event handler to stop the remaining handlers for the
 * current event. The bus queues the fallback event, if any, and carries on.
 */
@Getter
public class StopSentinel extends RuntimeException {

    private final DomainEvent fallbackEvent;
    private final Object result;

    public StopSentinel(String message) {
        this(message, null, null);
    }

    public StopSentinel(String message, DomainEvent fallbackEvent, Object result) {
        super(message);
        this.fallbackEvent = fallbackEvent;
        this.result = result;
    }
}
