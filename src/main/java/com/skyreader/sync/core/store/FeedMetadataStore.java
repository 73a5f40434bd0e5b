package com.skyreader.sync.core.store;

import java.time.Instant;

import com.skyreader.sync.core.model.ParsedFeed;

import reactor.core.publisher.Mono;

/**
 * Per-feed fetch bookkeeping in {@code feed_metadata}. Every method creates the row if missing.
 */
public interface FeedMetadataStore {

    /**
     * Stores descriptive fields and validators, resets the error counter and stamps both fetch times.
     */
    Mono<Void> recordSuccess(String feedUrl, ParsedFeed feed, String etag, String lastModified,
            int subscriberCount, Instant now);

    /**
     * Stamps the scheduled fetch time and subscriber count only.
     */
    Mono<Void> recordNotModified(String feedUrl, int subscriberCount, Instant now);

    /**
     * Increments the consecutive error counter and stores the message.
     */
    Mono<Void> recordError(String feedUrl, String message, Instant now);
}
