package com.flagship.iam_service.eventsourcing.model;

import com.flagship.iam_service.eventsourcing.topic.TopicResolutionException;
import com.flagship.iam_service.eventsourcing.topic.TopicResolver;

/**
 * The first event of every aggregate.
 *
 * Instead of patching an existing instance, mutate() builds a new aggregate
 * from the event fields. The event carries the topic of the aggregate type
 * so a stored log can be checked against the type it is replayed into.
 */
public interface AggregateCreated<A extends Aggregate> extends AggregateEvent<A> {

    String topic();

    /**
     * Builds the aggregate described by this event.
     */
    A construct();

    @Override
    default A mutate(Aggregate target) {
        if (target != null) {
            throw new AggregateVersionException(version(), target.getVersion() + 1);
        }
        if (version() != 1) {
            throw new AggregateVersionException(version(), 1);
        }
        if (!TopicResolver.topicFor(aggregateType()).equals(topic())) {
            throw new TopicResolutionException(topic());
        }
        return construct();
    }
}
