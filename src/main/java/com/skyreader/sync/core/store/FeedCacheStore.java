package com.skyreader.sync.core.store;

import java.time.Instant;

import com.skyreader.sync.core.model.CachedFeed;

import reactor.core.publisher.Mono;

/**
 * Serialized parsed feeds in {@code feed_cache}.
 */
public interface FeedCacheStore {

    Mono<CachedFeed> find(String feedUrl);

    Mono<Void> put(CachedFeed feed);

    /**
     * Refreshes {@code cached_at} without touching content. No-op when no row exists.
     */
    Mono<Void> touch(String feedUrl, Instant now);
}
