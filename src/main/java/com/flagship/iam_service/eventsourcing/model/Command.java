package com.flagship.iam_service.eventsourcing.model;

/**
 * Marker for an instruction addressed to exactly one handler.
 */
public interface Command extends Message {
}
