package com.skyreader.sync.core.model;

import java.time.Instant;

/**
 * One parsed feed item. {@code guid} is never blank: parsers fall back to the link, then to a slug of the title.
 */
public record FeedEntry(
        String guid,
        String url,
        String title,
        String author,
        String summary,
        String content,
        String imageUrl,
        Instant publishedAt) {
}
