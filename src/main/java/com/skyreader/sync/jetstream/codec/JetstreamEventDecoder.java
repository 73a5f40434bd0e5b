package com.skyreader.sync.jetstream.codec;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.model.CommitOperation;
import com.skyreader.sync.core.model.EventKind;
import com.skyreader.sync.core.model.JetstreamEvent;

/**
 * Decodes firehose frames into the closed {@link JetstreamEvent} union.
 *
 * <p>Never throws. Unparseable JSON and commit frames missing their identifying fields decode to
 * {@link EventKind#MALFORMED}; the stream time is kept when present so the cursor can still move past them.
 * Kinds we do not model decode to {@link EventKind#UNKNOWN}.</p>
 */
@Component
public class JetstreamEventDecoder {

    private static final Logger log = LoggerFactory.getLogger(JetstreamEventDecoder.class);

    private final ObjectMapper mapper;

    public JetstreamEventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JetstreamEvent decode(String frame) {
        JsonNode root;
        try {
            root = frame == null ? null : mapper.readTree(frame);
        } catch (IOException e) {
            log.debug("Undecodable frame: {}", e.getMessage());
            return JetstreamEvent.malformed();
        }
        if (root == null || !root.isObject()) {
            return JetstreamEvent.malformed();
        }

        String did = text(root, "did");
        JsonNode time = root.get("time_us");
        Long timeUs = time != null && time.canConvertToLong() && time.isIntegralNumber() ? time.asLong() : null;
        EventKind kind = EventKind.fromWire(text(root, "kind"));

        if (kind != EventKind.COMMIT) {
            return new JetstreamEvent(did, timeUs, kind, null);
        }

        JsonNode c = root.get("commit");
        if (c == null || !c.isObject()) {
            return new JetstreamEvent(did, timeUs, EventKind.MALFORMED, null);
        }

        JetstreamEvent.Commit commit = new JetstreamEvent.Commit(
                CommitOperation.fromWire(text(c, "operation")),
                text(c, "collection"),
                text(c, "rkey"),
                c.get("record"),
                text(c, "cid"),
                text(c, "rev"));

        if (isBlank(did) || isBlank(commit.collection()) || isBlank(commit.rkey())
                || commit.collection().indexOf('/') >= 0 || commit.rkey().indexOf('/') >= 0) {
            return new JetstreamEvent(did, timeUs, EventKind.MALFORMED, null);
        }
        return new JetstreamEvent(did, timeUs, EventKind.COMMIT, commit);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || !v.isTextual() ? null : v.asText();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
