package com.skyreader.sync.jetstream.client;

import java.time.Duration;
import java.util.List;

import com.skyreader.sync.core.model.WatchedCollection;

/**
 * What to subscribe to and when to stop.
 *
 * @param collections  collections to receive (at least one)
 * @param wantedDids   optional repository filter; empty means all repositories
 * @param resumeToken  last persisted position, or null to start at the live tail
 * @param idleTimeout  end the stream after this long without any frame; null for no idle bound
 * @param hardTimeout  end the stream after this long in total; null for no bound
 */
public record StreamRequest(
        List<WatchedCollection> collections,
        List<String> wantedDids,
        Long resumeToken,
        Duration idleTimeout,
        Duration hardTimeout) {

    public StreamRequest {
        collections = List.copyOf(collections);
        wantedDids = wantedDids == null ? List.of() : List.copyOf(wantedDids);
    }

    public static StreamRequest bounded(List<WatchedCollection> collections, List<String> wantedDids,
            Long resumeToken, Duration idleTimeout, Duration hardTimeout) {
        return new StreamRequest(collections, wantedDids, resumeToken, idleTimeout, hardTimeout);
    }

    public static StreamRequest unbounded(List<WatchedCollection> collections, List<String> wantedDids,
            Long resumeToken) {
        return new StreamRequest(collections, wantedDids, resumeToken, null, null);
    }
}
