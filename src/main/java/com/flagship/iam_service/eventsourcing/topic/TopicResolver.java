package com.flagship.iam_service.eventsourcing.topic;

import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two-way registry between topic strings and event/aggregate types.
 *
 * A topic has the form "package#Outer.Inner", e.g.
 * "com.flagship.iam_service.domain.iam#User.Created".
 *
 * Types are registered once during startup. Looking up a topic or type that
 * was never registered throws TopicResolutionException; nothing is loaded
 * by name at runtime.
 */
@Slf4j
public class TopicResolver {

    private final Map<String, Class<?>> typesByTopic = new ConcurrentHashMap<>();

    /**
     * Registers a type under its topic.
     *
     * @return the topic the type was registered under
     * @throws IllegalArgumentException for events that are not records,
     *         or when another type already owns the topic
     */
    public String register(Class<?> type) {
        if (DomainEvent.class.isAssignableFrom(type) && !type.isRecord()) {
            throw new IllegalArgumentException("Event types must be records: " + type.getName());
        }
        String topic = topicFor(type);
        Class<?> existing = typesByTopic.putIfAbsent(topic, type);
        if (existing != null && existing != type) {
            throw new IllegalArgumentException(
                    String.format("Topic %s already registered for %s", topic, existing.getName()));
        }
        log.debug("Registered topic: {}", topic);
        return topic;
    }

    public void registerAll(Collection<Class<?>> types) {
        types.forEach(this::register);
    }

    /**
     * Returns the topic of a registered type.
     */
    public String topicOf(Class<?> type) {
        String topic = topicFor(type);
        if (typesByTopic.get(topic) != type) {
            throw new TopicResolutionException("Type is not registered: " + type.getName());
        }
        return topic;
    }

    /**
     * Resolves a topic back to its registered type.
     */
    public Class<?> resolve(String topic) {
        Class<?> type = typesByTopic.get(topic);
        if (type == null) {
            throw new TopicResolutionException("Unknown topic: " + topic);
        }
        return type;
    }

    public boolean isRegistered(String topic) {
        return typesByTopic.containsKey(topic);
    }

    /**
     * Computes the topic string for a type without consulting the registry.
     */
    public static String topicFor(Class<?> type) {
        String canonicalName = type.getCanonicalName();
        if (canonicalName == null) {
            throw new IllegalArgumentException("Anonymous and local classes have no topic: " + type);
        }
        String packageName = type.getPackageName();
        String qualifiedName = packageName.isEmpty()
                ? canonicalName
                : canonicalName.substring(packageName.length() + 1);
        return packageName + "#" + qualifiedName;
    }
}
