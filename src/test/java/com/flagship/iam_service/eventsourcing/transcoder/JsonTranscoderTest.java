package com.flagship.iam_service.eventsourcing.transcoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.iam_service.config.JacksonConfig;
import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.domain.iam.IamTranscodings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonTranscoderTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private JsonTranscoder transcoder;

    @BeforeEach
    void setUp() {
        transcoder = IamTranscodings.registerAll(JsonTranscoder.withDefaults(objectMapper));
    }

    @Test
    @DisplayName("UUID is written as a hex envelope")
    void uuidEnvelope() throws Exception {
        UUID id = UUID.fromString("0f9b2c5e-1a2b-4c3d-8e4f-5a6b7c8d9e0f");

        JsonNode node = objectMapper.readTree(transcoder.encode(Map.of("id", id)));

        assertEquals("uuid_hex", node.get("id").get(JsonTranscoder.TYPE_KEY).asText());
        assertEquals("0f9b2c5e1a2b4c3d8e4f5a6b7c8d9e0f", node.get("id").get(JsonTranscoder.DATA_KEY).asText());
        assertEquals(Map.of("id", id), transcoder.decode(transcoder.encode(Map.of("id", id))));
    }

    @Test
    @DisplayName("Decimal keeps its scale and Instant keeps nanoseconds")
    void decimalAndInstant() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("amount", new BigDecimal("10.50"));
        value.put("at", Instant.parse("2024-03-01T12:00:00.123456789Z"));

        @SuppressWarnings("unchecked")
        Map<String, Object> decoded = (Map<String, Object>) transcoder.decode(transcoder.encode(value));

        assertEquals(new BigDecimal("10.50"), decoded.get("amount"));
        assertEquals(Instant.parse("2024-03-01T12:00:00.123456789Z"), decoded.get("at"));
    }

    @Test
    @DisplayName("Custom values nested in lists and maps are decoded bottom-up")
    void nestedValues() {
        UUID id = UUID.randomUUID();
        Map<String, Object> value = Map.of(
                "access", List.of(AccessPermission.ACADEMIC, AccessPermission.GPU),
                "inner", Map.of("ids", List.of(id)),
                "plain", List.of(1, "two", true));

        Object decoded = transcoder.decode(transcoder.encode(value));

        assertEquals(value, decoded);
    }

    @Test
    @DisplayName("Permission enums are written as their bit value")
    void permissionAsInt() throws Exception {
        JsonNode node = objectMapper.readTree(transcoder.encode(List.of(AccessPermission.ACADEMIC)));

        assertEquals("access_permission", node.get(0).get(JsonTranscoder.TYPE_KEY).asText());
        assertEquals(64, node.get(0).get(JsonTranscoder.DATA_KEY).asInt());
    }

    @Test
    @DisplayName("PostgreSQL uuid objects survive a round trip")
    void pgUuid() throws Exception {
        PGobject object = new PGobject();
        object.setType("uuid");
        object.setValue(UUID.randomUUID().toString());

        Object decoded = transcoder.decode(transcoder.encode(List.of(object)));

        assertEquals(List.of(object), decoded);
    }

    @Test
    @DisplayName("Unregistered types and tags fail")
    void unsupportedType() {
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(Map.of("x", new StringBuilder("x"))));

        byte[] unknownTag = "{\"__type__\":\"nope\",\"__data__\":1}".getBytes(StandardCharsets.UTF_8);
        assertThrows(UnsupportedTypeException.class, () -> transcoder.decode(unknownTag));
    }

    @Test
    @DisplayName("Objects with extra keys next to the envelope keys stay plain maps")
    void notAnEnvelope() {
        byte[] data = "{\"__type__\":\"uuid_hex\",\"__data__\":\"x\",\"other\":1}".getBytes(StandardCharsets.UTF_8);

        Object decoded = transcoder.decode(data);

        assertInstanceOf(Map.class, decoded);
        assertEquals(3, ((Map<?, ?>) decoded).size());
    }

    @Test
    @DisplayName("Re-registering a name replaces the previous transcoding")
    void reRegistration() {
        transcoder.register("uuid_hex", UUID.class, UUID::toString, data -> UUID.fromString((String) data));
        UUID id = UUID.randomUUID();

        String json = new String(transcoder.encode(List.of(id)), StandardCharsets.UTF_8);

        assertTrue(json.contains(id.toString()));
        assertEquals(List.of(id), transcoder.decode(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Integers, doubles, booleans and strings decode to the same Java type")
    void canonicalScalarsKeepTheirType() {
        List<Object> value = List.of(7, 0.1d, true, "text");

        List<?> decoded = (List<?>) transcoder.decode(transcoder.encode(value));

        assertEquals(value, decoded);
        assertInstanceOf(Integer.class, decoded.get(0));
        assertInstanceOf(Double.class, decoded.get(1));
    }

    @Test
    @DisplayName("Values that would decode as another type need a registered transcoding")
    void nonCanonicalValuesAreRejected() {
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(Map.of("n", 5L)));
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode((short) 5));
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode((byte) 5));
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(0.1f));
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(Set.of("a")));
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(new Object[]{"a"}));
        assertThrows(IllegalArgumentException.class, () -> transcoder.encode(Double.NaN));
    }

    @Test
    @DisplayName("A registered long transcoding brings Long values back as Long")
    void registeredLong() {
        transcoder.register("long_str", Long.class, n -> n.toString(), data -> Long.valueOf((String) data));
        Map<String, Object> value = Map.of("n", 5L, "big", Long.MAX_VALUE);

        @SuppressWarnings("unchecked")
        Map<String, Object> decoded = (Map<String, Object>) transcoder.decode(transcoder.encode(value));

        assertEquals(value, decoded);
        assertInstanceOf(Long.class, decoded.get("n"));
    }

    @Test
    @DisplayName("Non-string map keys are rejected")
    void nonStringKeys() {
        assertThrows(UnsupportedTypeException.class, () -> transcoder.encode(Map.of(1, "one")));
    }
}
