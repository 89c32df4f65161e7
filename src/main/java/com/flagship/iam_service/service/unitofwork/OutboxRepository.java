package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.outbox.OutboxEvent;
import com.flagship.iam_service.outbox.OutboxStore;

/**
 * Outbox access for one unit of work.
 */
public class OutboxRepository {

    private final EventMapper mapper;
    private final OutboxStore store;

    public OutboxRepository(EventMapper mapper, OutboxStore store) {
        this.mapper = mapper;
        this.store = store;
    }

    /**
     * Stages one outbox row for the event in the open transaction.
     */
    public OutboxEvent add(DomainEvent event) {
        OutboxEvent row = OutboxEvent.create(
                event.id(),
                mapper.topicOf(event),
                mapper.domainEventToOutboxState(event));
        store.append(row);
        return row;
    }
}
