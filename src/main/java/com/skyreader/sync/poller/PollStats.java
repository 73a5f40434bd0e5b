package com.skyreader.sync.poller;

import java.time.Instant;

/**
 * Result of one poll cycle, persisted as {@code last_stats}.
 */
public record PollStats(
        StreamCycleStats shares,
        StreamCycleStats follows,
        StreamCycleStats inappFollows,
        long durationMs,
        Instant lastPollAt) {
}
