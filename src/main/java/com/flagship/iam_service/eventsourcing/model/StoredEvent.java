package com.flagship.iam_service.eventsourcing.model;

import lombok.Value;

/**
 * Wire record of one event in the event store.
 *
 * (id, version) is unique across the store. The state is opaque to the
 * store: transcoded fields, optionally compressed and encrypted.
 */
@Value
public class StoredEvent {
    String id;          // aggregate id as string
    int version;
    String topic;
    byte[] state;
}
