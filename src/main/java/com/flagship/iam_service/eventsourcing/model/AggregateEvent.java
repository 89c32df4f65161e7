package com.flagship.iam_service.eventsourcing.model;

/**
 * A domain event that changes the state of one aggregate type.
 *
 * mutate() is the only path by which an aggregate changes. It checks that
 * the event is the direct successor of the aggregate's current version
 * before handing over to the type-specific apply() hook.
 *
 * @param <A> the aggregate type this event belongs to
 */
public interface AggregateEvent<A extends Aggregate> extends DomainEvent {

    Class<A> aggregateType();

    /**
     * Applies this event to the target and returns it.
     *
     * @throws NotAggregateException if the target is missing or of another aggregate type
     * @throws AggregateVersionException if this event is not exactly target.version + 1
     */
    default A mutate(Aggregate target) {
        if (target == null || !aggregateType().isInstance(target)) {
            throw new NotAggregateException(getClass(), target);
        }
        int expected = target.getVersion() + 1;
        if (version() != expected) {
            throw new AggregateVersionException(version(), expected);
        }
        target.advance(version(), timestamp());
        A aggregate = aggregateType().cast(target);
        apply(aggregate);
        return aggregate;
    }

    /**
     * Field-level changes for this event. Milestone events keep the default.
     */
    default void apply(A aggregate) {
    }
}
