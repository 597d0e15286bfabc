package com.p14n.shadowsync.codec;

import java.io.IOException;
import java.util.Comparator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The shared Jackson mapper and a few helpers around it.
 */
public final class JsonUtil {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private JsonUtil() {
    }

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    public static ObjectNode newObject() {
        return OBJECT_MAPPER.createObjectNode();
    }

    /**
     * Parses a complete JSON document.
     *
     * @throws IOException if the bytes are not a single well-formed document
     */
    public static JsonNode parse(byte[] bytes) throws IOException {
        return OBJECT_MAPPER.readTree(bytes);
    }

    public static JsonNode parse(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readTree(json);
    }

    public static byte[] toBytes(JsonNode node) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize JSON", e);
        }
    }

    /**
     * Converts any Jackson-serializable value into a tree; JsonNode values are
     * deep-copied.
     */
    public static JsonNode toNode(Object value) {
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        return OBJECT_MAPPER.valueToTree(value);
    }

    /**
     * Value equality where numbers compare by magnitude, so {@code 125} and
     * {@code 125.0} are the same value. Nulls are only equal to each other.
     */
    public static boolean sameValue(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equals(NUMERIC_AWARE, b);
    }
}
