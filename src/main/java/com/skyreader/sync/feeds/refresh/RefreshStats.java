package com.skyreader.sync.feeds.refresh;

import java.time.Instant;

/**
 * Summary of the last completed refresh cycle.
 */
public record RefreshStats(int fetched, int skipped, int errors, long durationMs, Instant lastCycleAt) {
}
