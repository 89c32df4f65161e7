package com.flagship.iam_service.service.unitofwork;

import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.model.Aggregate;
import com.flagship.iam_service.eventsourcing.model.AggregateEvent;
import com.flagship.iam_service.eventsourcing.model.AggregateNotFoundException;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.eventsourcing.model.NotAggregateException;
import com.flagship.iam_service.eventsourcing.model.StoredEvent;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Event-store access for one unit of work.
 *
 * add() collects an aggregate's pending events, appends them to the
 * recorder and queues the notifiable ones on the matching backlog.
 * get() rebuilds an aggregate by replaying its stored events in order.
 */
@Slf4j
public class EventStoreProxy {

    private final EventMapper mapper;
    private final ApplicationRecorder recorder;

    private final Deque<DomainEvent> internalBacklog = new ArrayDeque<>();
    private final Deque<DomainEvent> externalBacklog = new ArrayDeque<>();

    public EventStoreProxy(EventMapper mapper, ApplicationRecorder recorder) {
        this.mapper = mapper;
        this.recorder = recorder;
    }

    public void add(Aggregate aggregate) {
        List<AggregateEvent<?>> events = aggregate.collect();
        List<StoredEvent> stored = events.stream()
                .map(mapper::domainEventToStored)
                .toList();
        recorder.add(stored);

        for (AggregateEvent<?> event : events) {
            if (event.internallyNotifiable()) {
                internalBacklog.add(event);
            }
            if (event.externallyNotifiable()) {
                externalBacklog.add(event);
            }
        }
        log.debug("Stored {} event(s) for {} {}", events.size(),
                aggregate.getClass().getSimpleName(), aggregate.getId());
    }

    /**
     * @throws AggregateNotFoundException if nothing is stored under the id
     */
    public Aggregate get(UUID aggregateId) {
        Aggregate aggregate = null;
        for (StoredEvent stored : recorder.get(aggregateId)) {
            DomainEvent event = mapper.storedToDomainEvent(stored);
            if (!(event instanceof AggregateEvent<?> aggregateEvent)) {
                throw new NotAggregateException(event.getClass(), aggregate);
            }
            aggregate = aggregateEvent.mutate(aggregate);
        }
        if (aggregate == null) {
            throw new AggregateNotFoundException(aggregateId);
        }
        return aggregate;
    }

    /**
     * Removes and returns the backlog in FIFO order.
     */
    public List<DomainEvent> drain(Backlog backlog) {
        Deque<DomainEvent> queue = queue(backlog);
        List<DomainEvent> drained = new ArrayList<>(queue);
        queue.clear();
        return drained;
    }

    int size(Backlog backlog) {
        return queue(backlog).size();
    }

    /**
     * Drops events queued after the backlog had the given size.
     */
    void truncate(Backlog backlog, int size) {
        Deque<DomainEvent> queue = queue(backlog);
        while (queue.size() > size) {
            queue.pollLast();
        }
    }

    private Deque<DomainEvent> queue(Backlog backlog) {
        return backlog == Backlog.INTERNAL ? internalBacklog : externalBacklog;
    }
}
