package com.skyreader.sync.core.model;

import java.time.Instant;

/**
 * Serialized parsed feed as kept in {@code feed_cache}, with the validators it was fetched under.
 */
public record CachedFeed(String feedUrl, String content, String etag, String lastModified, Instant cachedAt) {
}
