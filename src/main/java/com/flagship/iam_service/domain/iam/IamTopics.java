package com.flagship.iam_service.domain.iam;

import com.flagship.iam_service.eventsourcing.topic.TopicResolver;

/**
 * Registers the IAM aggregates and their events with a topic resolver.
 */
public final class IamTopics {

    private IamTopics() {
    }

    public static TopicResolver registerAll(TopicResolver resolver) {
        resolver.register(User.class);
        resolver.registerAll(User.eventTypes());
        resolver.register(Group.class);
        resolver.registerAll(Group.eventTypes());
        return resolver;
    }
}
