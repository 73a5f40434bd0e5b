package com.skyreader.sync.core.store;

import java.time.Instant;
import java.util.List;

import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ItemStoreResult;

import reactor.core.publisher.Mono;

/**
 * Items in {@code feed_items}, unique per {@code (feed_url, guid)}.
 */
public interface FeedItemStore {

    /**
     * Inserts unseen items and refreshes changed ones (by content hash).
     *
     * @return how many items were new, and whether the feed had no items before
     */
    Mono<ItemStoreResult> storeItems(String feedUrl, List<FeedEntry> items, Instant now);
}
