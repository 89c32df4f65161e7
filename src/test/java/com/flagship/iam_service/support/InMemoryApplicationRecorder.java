package com.flagship.iam_service.support;

import com.flagship.iam_service.eventsourcing.model.Notification;
import com.flagship.iam_service.eventsourcing.model.StoredEvent;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.eventsourcing.recorder.RecorderIntegrityException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Recorder kept in a list, with the same (id, version) uniqueness as the
 * database table. mark() and reset() stand in for begin and rollback.
 */
public class InMemoryApplicationRecorder implements ApplicationRecorder {

    private final List<Notification> rows = new ArrayList<>();
    private int mark;

    @Override
    public synchronized void add(List<StoredEvent> events) {
        Set<String> keys = new HashSet<>();
        rows.forEach(row -> keys.add(row.getId() + "/" + row.getVersion()));
        for (StoredEvent event : events) {
            if (!keys.add(event.getId() + "/" + event.getVersion())) {
                throw new RecorderIntegrityException(
                        "Duplicate event: id=" + event.getId() + " version=" + event.getVersion(), null);
            }
        }
        for (StoredEvent event : events) {
            rows.add(new Notification(rows.size() + 1, event.getId(), event.getVersion(),
                    event.getTopic(), event.getState()));
        }
    }

    @Override
    public synchronized List<StoredEvent> get(UUID aggregateId) {
        return rows.stream()
                .filter(row -> row.getId().equals(aggregateId.toString()))
                .sorted(Comparator.comparingInt(Notification::getVersion))
                .map(Notification::toStoredEvent)
                .toList();
    }

    @Override
    public synchronized List<Notification> selectNotifications(long start, int limit) {
        return rows.stream()
                .filter(row -> row.getNotificationId() >= start)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized long maxNotificationId() {
        return rows.size();
    }

    synchronized void mark() {
        mark = rows.size();
    }

    synchronized void reset() {
        while (rows.size() > mark) {
            rows.remove(rows.size() - 1);
        }
    }

    public synchronized int size() {
        return rows.size();
    }
}
