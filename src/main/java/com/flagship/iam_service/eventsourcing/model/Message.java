package com.flagship.iam_service.eventsourcing.model;

/**
 * Anything the message bus can route: a command or a domain event.
 */
public interface Message {
}
