package com.flagship.iam_service.eventsourcing.topic;

import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.IamTopics;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TopicResolverTest {

    private TopicResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = IamTopics.registerAll(new TopicResolver());
    }

    @Test
    @DisplayName("Topic is package, hash, then the nested class path")
    void topicFormat() {
        assertEquals("com.flagship.iam_service.domain.iam#User.Created",
                TopicResolver.topicFor(User.Created.class));
        assertEquals("com.flagship.iam_service.domain.iam#Group",
                TopicResolver.topicFor(Group.class));
    }

    @Test
    @DisplayName("Registered topics resolve back to their types")
    void resolvesRegisteredTopics() {
        String topic = resolver.topicOf(Group.GroupRoleCreated.class);

        assertSame(Group.GroupRoleCreated.class, resolver.resolve(topic));
        assertSame(User.class, resolver.resolve(TopicResolver.topicFor(User.class)));
        assertTrue(resolver.isRegistered(topic));
    }

    @Test
    @DisplayName("Unknown topics and unregistered types fail")
    void unknownTopic() {
        TopicResolver empty = new TopicResolver();

        assertThrows(TopicResolutionException.class, () -> empty.resolve("com.example#Missing"));
        assertThrows(TopicResolutionException.class, () -> empty.topicOf(User.Created.class));
        assertFalse(empty.isRegistered(TopicResolver.topicFor(User.Created.class)));
    }

    @Test
    @DisplayName("Registering the same type twice is harmless")
    void repeatRegistration() {
        String first = resolver.register(User.Created.class);
        String second = resolver.register(User.Created.class);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Event types that are not records are rejected at registration")
    void eventsMustBeRecords() {
        assertThrows(IllegalArgumentException.class, () -> resolver.register(ClassEvent.class));
    }

    static class ClassEvent implements DomainEvent {
        @Override
        public UUID id() {
            return null;
        }

        @Override
        public int version() {
            return 0;
        }

        @Override
        public Instant timestamp() {
            return null;
        }
    }
}
