package com.flagship.iam_service.eventsourcing.recorder;

import com.flagship.iam_service.eventsourcing.model.StoredEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of stored events keyed by aggregate id and version.
 */
public interface AggregateRecorder {

    /**
     * Appends a batch. The whole batch fails on any constraint violation.
     *
     * @throws RecorderIntegrityException on a duplicate (id, version) or any storage fault
     */
    void add(List<StoredEvent> events);

    /**
     * Events of one aggregate in ascending version order; empty if none were stored.
     */
    List<StoredEvent> get(UUID aggregateId);
}
