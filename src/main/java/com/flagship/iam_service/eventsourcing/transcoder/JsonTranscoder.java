package com.flagship.iam_service.eventsourcing.transcoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.iam_service.eventsourcing.transcoder.transcodings.DecimalAsString;
import com.flagship.iam_service.eventsourcing.transcoder.transcodings.InstantAsIso;
import com.flagship.iam_service.eventsourcing.transcoder.transcodings.PgUuidAsHex;
import com.flagship.iam_service.eventsourcing.transcoder.transcodings.UuidAsHex;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Transcoder backed by the Jackson tree model.
 *
 * String, Boolean, Integer, finite Double, lists and string-keyed maps
 * are written as they are; these are exactly the types decoding gives back.
 * Any other value, including Long, Float, sets and arrays, is looked up by
 * its exact runtime class and written as an envelope:
 *
 *   {"__type__": "uuid_hex", "__data__": "0f9b..."}
 *
 * Decoding works bottom-up: nested values are decoded first, then an
 * object with exactly the two envelope keys is handed to the transcoding
 * registered under its tag.
 */
@Slf4j
public class JsonTranscoder implements Transcoder {

    static final String TYPE_KEY = "__type__";
    static final String DATA_KEY = "__data__";

    private final ObjectMapper objectMapper;
    private final Map<Class<?>, Transcoding<?>> transcodingsByType = new ConcurrentHashMap<>();
    private final Map<String, Transcoding<?>> transcodingsByName = new ConcurrentHashMap<>();

    public JsonTranscoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a transcoder with the UUID, PostgreSQL UUID, decimal and
     * timestamp transcodings registered.
     */
    public static JsonTranscoder withDefaults(ObjectMapper objectMapper) {
        JsonTranscoder transcoder = new JsonTranscoder(objectMapper);
        transcoder.register(new UuidAsHex());
        transcoder.register(new PgUuidAsHex());
        transcoder.register(new DecimalAsString());
        transcoder.register(new InstantAsIso());
        return transcoder;
    }

    @Override
    public void register(Transcoding<?> transcoding) {
        Transcoding<?> previous = transcodingsByName.put(transcoding.name(), transcoding);
        if (previous != null) {
            transcodingsByType.remove(previous.type(), previous);
            log.debug("Replaced transcoding: name={}, previousType={}",
                    transcoding.name(), previous.type().getName());
        }
        transcodingsByType.put(transcoding.type(), transcoding);
    }

    /**
     * Registers a transcoding from a pair of functions.
     */
    public <T> void register(String name, Class<T> type,
                             Function<T, Object> encoder, Function<Object, T> decoder) {
        register(new Transcoding<T>() {
            @Override
            public Class<T> type() {
                return type;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public Object encode(T value) {
                return encoder.apply(value);
            }

            @Override
            public T decode(Object data) {
                return decoder.apply(data);
            }
        });
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode value", e);
        }
    }

    @Override
    public Object decode(byte[] data) {
        try {
            return fromNode(objectMapper.readTree(data));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to decode payload", e);
        }
    }

    private JsonNode toNode(Object value) {
        JsonNodeFactory nodes = objectMapper.getNodeFactory();
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof String s) {
            return nodes.textNode(s);
        }
        if (value instanceof Boolean b) {
            return nodes.booleanNode(b);
        }
        if (value instanceof Integer i) {
            return nodes.numberNode(i.intValue());
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new IllegalArgumentException("Cannot encode non-finite number: " + d);
            }
            return nodes.numberNode(d.doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = nodes.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new UnsupportedTypeException(
                            entry.getKey() == null ? Object.class : entry.getKey().getClass());
                }
                object.set(key, toNode(entry.getValue()));
            }
            return object;
        }
        if (value instanceof List<?> list) {
            ArrayNode array = nodes.arrayNode(list.size());
            list.forEach(item -> array.add(toNode(item)));
            return array;
        }
        return toEnvelope(value, nodes);
    }

    private JsonNode toEnvelope(Object value, JsonNodeFactory nodes) {
        Transcoding<?> transcoding = transcodingsByType.get(value.getClass());
        if (transcoding == null) {
            throw new UnsupportedTypeException(value.getClass());
        }
        ObjectNode envelope = nodes.objectNode();
        envelope.put(TYPE_KEY, transcoding.name());
        envelope.set(DATA_KEY, toNode(encodeWith(transcoding, value)));
        return envelope;
    }

    private static <T> Object encodeWith(Transcoding<T> transcoding, Object value) {
        return transcoding.encode(transcoding.type().cast(value));
    }

    private Object fromNode(JsonNode node) {
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), fromNode(field.getValue()));
            }
            return isEnvelope(map) ? fromEnvelope(map) : map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(fromNode(item)));
            return list;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }

    private static boolean isEnvelope(Map<String, Object> map) {
        return map.size() == 2
                && map.get(TYPE_KEY) instanceof String
                && map.containsKey(DATA_KEY);
    }

    private Object fromEnvelope(Map<String, Object> envelope) {
        String name = (String) envelope.get(TYPE_KEY);
        Transcoding<?> transcoding = transcodingsByName.get(name);
        if (transcoding == null) {
            throw new UnsupportedTypeException(name);
        }
        return transcoding.decode(envelope.get(DATA_KEY));
    }
}
