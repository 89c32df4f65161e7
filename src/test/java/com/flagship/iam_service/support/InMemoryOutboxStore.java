package com.flagship.iam_service.support;

import com.flagship.iam_service.outbox.OutboxEvent;
import com.flagship.iam_service.outbox.OutboxStore;

import java.util.ArrayList;
import java.util.List;

public class InMemoryOutboxStore implements OutboxStore {

    private final List<OutboxEvent> rows = new ArrayList<>();
    private int mark;

    @Override
    public synchronized void append(OutboxEvent event) {
        rows.add(event);
    }

    synchronized void mark() {
        mark = rows.size();
    }

    synchronized void reset() {
        while (rows.size() > mark) {
            rows.remove(rows.size() - 1);
        }
    }

    public synchronized List<OutboxEvent> rows() {
        return List.copyOf(rows);
    }
}
