package com.skyreader.sync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Hub wire message: {@code {"type": "...", "payload": {...}}}. The type is kept as a free string so
 * unrecognized types can still be broadcast to everyone.
 */
public record RealtimeMessage(String type, JsonNode payload) {

    public RealtimeMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload;
    }

    public static RealtimeMessage of(NotificationType type, ObjectNode payload) {
        return new RealtimeMessage(type.wire(), payload);
    }

    public String payloadText(String field) {
        JsonNode v = payload.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
