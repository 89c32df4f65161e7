package com.flagship.iam_service.eventsourcing.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Base class for event-sourced aggregates.
 *
 * State is derived only from events:
 * - create() applies a Created event and returns the new instance
 * - trigger() stamps the next version on a new event, applies it and queues it
 * - collect() drains the queued events once, in the order they were triggered
 *
 * The version always equals the version of the last applied event.
 */
@Getter
public abstract class Aggregate {

    private final UUID id;
    private int version;
    private final Instant createdAt;
    private Instant updatedAt;

    @Getter(AccessLevel.NONE)
    private final Deque<AggregateEvent<?>> pendingEvents = new ArrayDeque<>();

    protected Aggregate(AggregateCreated<?> created) {
        this.id = created.id();
        this.version = created.version();
        this.createdAt = created.timestamp();
        this.updatedAt = created.timestamp();
    }

    /**
     * Applies a Created event and queues it on the resulting aggregate.
     */
    protected static <A extends Aggregate> A create(AggregateCreated<A> created) {
        A aggregate = created.mutate(null);
        ((Aggregate) aggregate).pendingEvents.add(created);
        return aggregate;
    }

    /**
     * Builds the next event through the factory, applies it and queues it.
     */
    protected <E extends AggregateEvent<?>> E trigger(EventFactory<E> factory) {
        E event = factory.create(id, version + 1, Instant.now());
        event.mutate(this);
        pendingEvents.add(event);
        return event;
    }

    /**
     * Drains the pending events in FIFO order. A second call returns an
     * empty list until new events are triggered.
     */
    public List<AggregateEvent<?>> collect() {
        List<AggregateEvent<?>> collected = new ArrayList<>(pendingEvents.size());
        while (!pendingEvents.isEmpty()) {
            collected.add(pendingEvents.poll());
        }
        return collected;
    }

    /**
     * Snapshot of the events triggered but not yet collected.
     */
    public List<AggregateEvent<?>> getPendingEvents() {
        return List.copyOf(pendingEvents);
    }

    void advance(int version, Instant timestamp) {
        this.version = version;
        this.updatedAt = timestamp;
    }

    /**
     * Stamps aggregate id, next version and time onto a new event.
     */
    @FunctionalInterface
    public interface EventFactory<E> {
        E create(UUID aggregateId, int version, Instant timestamp);
    }
}
