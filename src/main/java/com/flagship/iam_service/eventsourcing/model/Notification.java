package com.flagship.iam_service.eventsourcing.model;

import lombok.Value;

/**
 * A stored event read back together with its global sequence number.
 */
@Value
public class Notification {
    long notificationId;
    String id;
    int version;
    String topic;
    byte[] state;

    public StoredEvent toStoredEvent() {
        return new StoredEvent(id, version, topic, state);
    }
}
