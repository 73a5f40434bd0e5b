package com.skyreader.sync.core.model;

import java.time.Instant;

/**
 * A subscribed feed considered for a scheduled refresh, with the metadata needed to order, filter and
 * conditionally fetch it.
 *
 * @param lastScheduledFetchAt null when the feed was never fetched by the scheduler
 */
public record RefreshCandidate(
        String feedUrl,
        int subscriberCount,
        int errorCount,
        Instant lastScheduledFetchAt,
        String etag,
        String lastModified) {

    public static RefreshCandidate of(String feedUrl, int subscriberCount) {
        return new RefreshCandidate(feedUrl, subscriberCount, 0, null, null, null);
    }
}
