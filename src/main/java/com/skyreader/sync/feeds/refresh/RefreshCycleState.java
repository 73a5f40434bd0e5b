package com.skyreader.sync.feeds.refresh;

import java.time.Instant;
import java.util.List;

import com.skyreader.sync.core.model.RefreshCandidate;

/**
 * Progress of one refresh cycle, persisted between batches.
 */
public record RefreshCycleState(
        List<RefreshCandidate> feeds,
        int currentIndex,
        int fetched,
        int skipped,
        int errors,
        Instant startedAt) {

    public RefreshCycleState {
        feeds = feeds == null ? List.of() : List.copyOf(feeds);
    }

    public static RefreshCycleState start(List<RefreshCandidate> feeds, Instant now) {
        return new RefreshCycleState(feeds, 0, 0, 0, 0, now);
    }

    public boolean complete() {
        return currentIndex >= feeds.size();
    }

    public List<RefreshCandidate> nextBatch(int size) {
        return feeds.subList(Math.min(currentIndex, feeds.size()), Math.min(currentIndex + size, feeds.size()));
    }

    public RefreshCycleState advance(int processed, int batchFetched, int batchSkipped, int batchErrors) {
        return new RefreshCycleState(feeds, currentIndex + processed, fetched + batchFetched,
                skipped + batchSkipped, errors + batchErrors, startedAt);
    }

    public String progress() {
        return currentIndex + "/" + feeds.size();
    }
}
