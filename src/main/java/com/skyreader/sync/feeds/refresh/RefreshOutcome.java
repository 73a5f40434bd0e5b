package com.skyreader.sync.feeds.refresh;

/**
 * Result of refreshing one feed. {@link #NOT_MODIFIED} and {@link #SKIPPED} both count as skipped in cycle
 * statistics.
 */
public enum RefreshOutcome {
    FETCHED,
    NOT_MODIFIED,
    SKIPPED,
    FAILED
}
