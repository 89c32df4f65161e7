package com.flagship.iam_service.eventsourcing.topic;

/**
 * A topic or type is missing from the registry.
 * Indicates a registration defect in the startup wiring.
 */
public class TopicResolutionException extends RuntimeException {

    public TopicResolutionException(String message) {
        super(message);
    }
}
