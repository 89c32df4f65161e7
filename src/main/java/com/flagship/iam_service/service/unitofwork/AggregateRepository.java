package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.eventsourcing.model.Aggregate;
import com.flagship.iam_service.eventsourcing.model.AggregateNotFoundException;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;

import java.util.List;
import java.util.UUID;

/**
 * Typed handle on an event store proxy for one aggregate type.
 * Several handles may share the same proxy.
 */
public class AggregateRepository<A extends Aggregate> {

    private final EventStoreProxy eventStore;
    private final Class<A> aggregateType;

    public AggregateRepository(EventStoreProxy eventStore, Class<A> aggregateType) {
        this.eventStore = eventStore;
        this.aggregateType = aggregateType;
    }

    public void add(A aggregate) {
        eventStore.add(aggregate);
    }

    /**
     * @throws AggregateNotFoundException if no events are stored, or they
     *         describe another aggregate type
     */
    public A get(UUID aggregateId) {
        Aggregate aggregate = eventStore.get(aggregateId);
        if (!aggregateType.isInstance(aggregate)) {
            throw new AggregateNotFoundException(aggregateId, aggregateType);
        }
        return aggregateType.cast(aggregate);
    }

    List<DomainEvent> drainBacklog(Backlog backlog) {
        return eventStore.drain(backlog);
    }

    EventStoreProxy eventStore() {
        return eventStore;
    }
}
