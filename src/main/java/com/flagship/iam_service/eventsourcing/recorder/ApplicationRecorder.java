package com.flagship.iam_service.eventsourcing.recorder;

import com.flagship.iam_service.eventsourcing.model.Notification;

import java.util.List;

/**
 * Recorder that also exposes the global notification sequence.
 */
public interface ApplicationRecorder extends AggregateRecorder {

    /**
     * Events with sequence >= start, in sequence order, at most limit rows.
     */
    List<Notification> selectNotifications(long start, int limit);

    /**
     * Highest sequence number, or 0 for an empty store.
     */
    long maxNotificationId();
}
