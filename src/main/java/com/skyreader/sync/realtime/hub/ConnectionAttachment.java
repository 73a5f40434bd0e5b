package com.skyreader.sync.realtime.hub;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Versioned per-connection state persisted on the socket: {@code {"v":1,"did":"...","lastHeartbeat":<millis>}}.
 *
 * <p>Readers accept only versions they know. New fields may be added within a version; removing or changing
 * the meaning of a field needs a new version.</p>
 */
public record ConnectionAttachment(String did, Instant lastHeartbeat) {

    public static final int VERSION = 1;

    public String encode(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("v", VERSION);
        node.put("did", did);
        node.put("lastHeartbeat", lastHeartbeat.toEpochMilli());
        return node.toString();
    }

    /**
     * @return the attachment, or empty when missing, of an unknown version or malformed
     */
    public static Optional<ConnectionAttachment> decode(ObjectMapper mapper, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node.path("v").asInt(-1) != VERSION) {
            return Optional.empty();
        }
        String did = node.path("did").asText("");
        JsonNode heartbeat = node.get("lastHeartbeat");
        if (did.isBlank() || heartbeat == null || !heartbeat.canConvertToLong()) {
            return Optional.empty();
        }
        return Optional.of(new ConnectionAttachment(did, Instant.ofEpochMilli(heartbeat.asLong())));
    }
}
