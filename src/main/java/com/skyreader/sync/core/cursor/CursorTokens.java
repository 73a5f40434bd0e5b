package com.skyreader.sync.core.cursor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Helpers for microsecond stream-time tokens.
 */
public final class CursorTokens {

    private CursorTokens() {
    }

    /**
     * Position to start from when a stream has no cursor yet: the current time, so the first cycle tails the
     * live log instead of replaying history.
     */
    public static long baseline(Clock clock) {
        return toMicros(clock.instant());
    }

    /**
     * Rewinds {@code token} by the overlap window so redelivered events are replayed rather than missed.
     */
    public static long withOverlap(long token, Duration overlap) {
        return Math.max(0L, token - TimeUnit.NANOSECONDS.toMicros(overlap.toNanos()));
    }

    public static long toMicros(Instant instant) {
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond()) + instant.getNano() / 1_000L;
    }

    public static Instant toInstant(long micros) {
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }
}
