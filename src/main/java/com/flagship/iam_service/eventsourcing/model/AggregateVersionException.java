package com.flagship.iam_service.eventsourcing.model;

import lombok.Getter;

/**
 * Thrown when an event is not the direct successor of the aggregate version.
 * Signals a concurrent writer or a broken log; the unit of work must abort.
 */
@Getter
public class AggregateVersionException extends RuntimeException {

    private final int actual;
    private final int expected;

    public AggregateVersionException(int actual, int expected) {
        super(String.format("Event version %d does not follow aggregate, expected %d", actual, expected));
        this.actual = actual;
        this.expected = expected;
    }
}
