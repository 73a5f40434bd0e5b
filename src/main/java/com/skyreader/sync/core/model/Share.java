package com.skyreader.sync.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A cached share row. Keyed by {@link #recordUri()}; every other field is a pure function of the record value.
 */
public record Share(
        String authorDid,
        RecordUri recordUri,
        String recordCid,
        String feedUrl,
        String itemUrl,
        String itemTitle,
        String itemAuthor,
        String itemDescription,
        String itemImage,
        String itemGuid,
        Instant itemPublishedAt,
        String note,
        List<String> tags,
        String content,
        Instant createdAt) {

    public Share {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public Share withContent(String content) {
        return new Share(authorDid, recordUri, recordCid, feedUrl, itemUrl, itemTitle, itemAuthor, itemDescription,
                itemImage, itemGuid, itemPublishedAt, note, tags, content, createdAt);
    }
}
