package com.flagship.iam_service.eventsourcing.mapper;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.eventsourcing.model.StoredEvent;
import com.flagship.iam_service.eventsourcing.topic.TopicResolver;
import com.flagship.iam_service.eventsourcing.transcoder.Transcoder;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Translates domain events to stored events and back.
 *
 * Write path: fields minus id and version -> transcoder -> compress -> encrypt.
 * Read path: decrypt -> decompress -> transcoder -> fields plus id and version
 * -> record of the type registered under the topic.
 *
 * Record components are read and the record rebuilt through Jackson, so
 * decoded values are converted to the component types (Integer to long,
 * string to UUID, and so on). Keys the record does not declare are
 * ignored; components with no key get Jackson's absent value (0, false
 * or null).
 *
 * Compressor and cipher are both optional.
 */
@Slf4j
public class EventMapper {

    private static final String ID_FIELD = "id";
    private static final String VERSION_FIELD = "version";

    private final ObjectMapper objectMapper;
    private final Transcoder transcoder;
    private final TopicResolver topicResolver;
    private final Compressor compressor;
    private final EventCipher cipher;

    public EventMapper(ObjectMapper objectMapper, Transcoder transcoder, TopicResolver topicResolver) {
        this(objectMapper, transcoder, topicResolver, null, null);
    }

    public EventMapper(ObjectMapper objectMapper, Transcoder transcoder, TopicResolver topicResolver,
                       Compressor compressor, EventCipher cipher) {
        this.objectMapper = objectMapper;
        this.transcoder = transcoder;
        this.topicResolver = topicResolver;
        this.compressor = compressor;
        this.cipher = cipher;
    }

    public StoredEvent domainEventToStored(DomainEvent event) {
        String topic = topicResolver.topicOf(event.getClass());

        Map<String, Object> fields = fieldsOf(event);
        fields.remove(ID_FIELD);
        fields.remove(VERSION_FIELD);

        byte[] state = transcoder.encode(fields);
        if (compressor != null) {
            state = compressor.compress(state);
        }
        if (cipher != null) {
            state = cipher.encrypt(state);
        }
        return new StoredEvent(event.id().toString(), event.version(), topic, state);
    }

    public DomainEvent storedToDomainEvent(StoredEvent stored) {
        byte[] state = stored.getState();
        if (cipher != null) {
            state = cipher.decrypt(state);
        }
        if (compressor != null) {
            state = compressor.decompress(state);
        }

        Map<String, Object> fields = decodeFields(state);
        fields.put(ID_FIELD, UUID.fromString(stored.getId()));
        fields.put(VERSION_FIELD, stored.getVersion());
        return construct(stored.getTopic(), fields);
    }

    /**
     * State for an outbox row: transcoded fields without the id, which the
     * row carries as aggregate id. Outbox state is never compressed or encrypted.
     */
    public byte[] domainEventToOutboxState(DomainEvent event) {
        topicResolver.topicOf(event.getClass());
        Map<String, Object> fields = fieldsOf(event);
        fields.remove(ID_FIELD);
        return transcoder.encode(fields);
    }

    public DomainEvent outboxStateToDomainEvent(UUID aggregateId, String topic, byte[] state) {
        Map<String, Object> fields = decodeFields(state);
        fields.put(ID_FIELD, aggregateId);
        return construct(topic, fields);
    }

    public String topicOf(DomainEvent event) {
        return topicResolver.topicOf(event.getClass());
    }

    private Map<String, Object> fieldsOf(DomainEvent event) {
        if (!event.getClass().isRecord()) {
            throw new IllegalArgumentException("Event is not a record: " + event.getClass().getName());
        }
        SerializationConfig config = objectMapper.getSerializationConfig();
        BeanDescription description = config.introspect(objectMapper.constructType(event.getClass()));
        Map<String, Object> fields = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            if (config.canOverrideAccessModifiers()) {
                accessor.fixAccess(config.isEnabled(MapperFeature.OVERRIDE_PUBLIC_ACCESS_MODIFIERS));
            }
            fields.put(property.getName(), accessor.getValue(event));
        }
        return fields;
    }

    private Map<String, Object> decodeFields(byte[] state) {
        Object decoded = transcoder.decode(state);
        if (!(decoded instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Event state is not an object");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        map.forEach((key, value) -> fields.put((String) key, value));
        return fields;
    }

    private DomainEvent construct(String topic, Map<String, Object> fields) {
        Class<?> type = topicResolver.resolve(topic);
        if (!DomainEvent.class.isAssignableFrom(type) || !type.isRecord()) {
            throw new IllegalArgumentException("Topic does not name an event record: " + topic);
        }
        log.trace("Rebuilding event: topic={}, id={}", topic, fields.get(ID_FIELD));
        return objectMapper.convertValue(fields, type.asSubclass(DomainEvent.class));
    }
}
