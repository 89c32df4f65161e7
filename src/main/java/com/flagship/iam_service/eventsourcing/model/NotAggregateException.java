package com.flagship.iam_service.eventsourcing.model;

/**
 * Thrown when an event is applied to something that is not an aggregate of its type.
 */
public class NotAggregateException extends RuntimeException {

    public NotAggregateException(Class<?> eventType, Object target) {
        super(String.format("%s cannot be applied to %s",
                eventType.getSimpleName(),
                target == null ? "no aggregate" : target.getClass().getSimpleName()));
    }
}
