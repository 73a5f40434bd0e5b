package com.skyreader.sync.poller;

/**
 * Per-stream counters of one poll cycle.
 *
 * @param processed events handed to a processor that completed
 * @param errors    malformed frames plus processor failures
 */
public record StreamCycleStats(int processed, int errors) {

    public static final StreamCycleStats EMPTY = new StreamCycleStats(0, 0);
}
