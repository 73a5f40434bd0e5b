package com.skyreader.sync.core.store;

import java.time.Instant;

import com.skyreader.sync.core.model.RefreshCandidate;

import reactor.core.publisher.Flux;

/**
 * Read side of {@code subscriptions_cache} joined with feed metadata.
 */
public interface SubscriptionStore {

    /**
     * Current subscribers of a feed URL. Always read from storage.
     */
    Flux<String> subscribersOf(String feedUrl);

    /**
     * Distinct feeds subscribed to by users active since {@code activeSince}, with their subscriber counts
     * and fetch metadata. Ordered by last scheduled fetch (never fetched first), then subscriber count
     * descending. Feeds with {@code error_count >= maxErrorCount} are excluded.
     */
    Flux<RefreshCandidate> refreshCandidates(Instant activeSince, int maxErrorCount, int limit);
}
