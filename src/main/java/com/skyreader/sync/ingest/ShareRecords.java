package com.skyreader.sync.ingest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyreader.sync.core.model.RecordUri;
import com.skyreader.sync.core.model.Share;

/**
 * Reads {@code app.skyreader.social.share} record values.
 */
final class ShareRecords {

    private ShareRecords() {
    }

    static Share toShare(RecordUri uri, String cid, JsonNode record, Instant fallbackCreatedAt) {
        String itemUrl = text(record, "itemUrl");
        if (itemUrl == null) {
            throw new InvalidRecordException("share " + uri + " has no itemUrl");
        }
        if (cid == null) {
            throw new InvalidRecordException("share " + uri + " has no cid");
        }

        List<String> tags = new ArrayList<>();
        JsonNode t = record.get("tags");
        if (t != null && t.isArray()) {
            t.forEach(tag -> {
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    tags.add(tag.asText());
                }
            });
        }

        Instant createdAt = instant(record, "createdAt");
        return new Share(
                uri.did(),
                uri,
                cid,
                text(record, "feedUrl"),
                itemUrl,
                text(record, "itemTitle"),
                text(record, "itemAuthor"),
                text(record, "itemDescription"),
                text(record, "itemImage"),
                text(record, "itemGuid"),
                instant(record, "itemPublishedAt"),
                text(record, "note"),
                tags,
                null,
                createdAt == null ? fallbackCreatedAt : createdAt);
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            return null;
        }
        return v.asText();
    }

    static Instant instant(JsonNode node, String field) {
        String v = text(node, field);
        if (v == null) {
            return null;
        }
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
