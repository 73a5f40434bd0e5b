package com.skyreader.sync.core.cursor;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.support.InMemoryStateStore;

import reactor.test.StepVerifier;

class StateCursorStoreTest {

    private final InMemoryStateStore state = new InMemoryStateStore();
    private final StateCursorStore cursors = new StateCursorStore(state);

    @Test
    void roundTripsAndOverwrites() {
        cursors.put("cursor_shares", 10L).block();
        cursors.put("cursor_shares", 12L).block();

        StepVerifier.create(cursors.get("cursor_shares")).expectNext(12L).verifyComplete();
        StepVerifier.create(cursors.get("cursor_follows")).verifyComplete();
    }

    @Test
    void unreadableCursorIsTreatedAsAbsent() {
        state.put("cursor_shares", "yesterday").block();

        StepVerifier.create(cursors.get("cursor_shares")).verifyComplete();
    }

    @Test
    void tokenHelpers() {
        Instant t = Instant.parse("2026-10-01T00:00:01.000002Z");

        assertThat(CursorTokens.toMicros(t)).isEqualTo(t.getEpochSecond() * 1_000_000L + 2);
        assertThat(CursorTokens.toInstant(CursorTokens.toMicros(t))).isEqualTo(t);
        assertThat(CursorTokens.withOverlap(10_000_000L, Duration.ofSeconds(5))).isEqualTo(5_000_000L);
        assertThat(CursorTokens.withOverlap(1L, Duration.ofSeconds(5))).isZero();
    }
}
