package com.meetchat.client.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Map;

/**
 * Wire helpers for the {@code {"event": ..., "data": {...}}} envelope.
 */
public final class JsonUtil {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtil() {
    }

    /** A decoded frame; {@code data} is never null. */
    public record Envelope(String event, JsonNode data) {
        public String text(String field) {
            JsonNode n = data.get(field);
            return n == null || n.isNull() ? null : n.asText();
        }

        public <T> T as(Class<T> type) throws JsonProcessingException {
            return MAPPER.treeToValue(data, type);
        }

        public <T> T field(String name, Class<T> type) throws JsonProcessingException {
            JsonNode n = data.get(name);
            return n == null ? null : MAPPER.treeToValue(n, type);
        }
    }

    public static String envelope(String event, Map<String, ?> data) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("event", event);
        root.set("data", MAPPER.valueToTree(data));
        return root.toString();
    }

    /** @throws IOException when the frame is not a JSON object with a string {@code event} */
    public static Envelope parse(String frame) throws IOException {
        JsonNode root = MAPPER.readTree(frame);
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            throw new IOException("Malformed frame");
        }
        JsonNode data = root.get("data");
        return new Envelope(root.get("event").asText(), data == null || data.isNull() ? MAPPER.createObjectNode() : data);
    }
}
