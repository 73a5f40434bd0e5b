package com.skyreader.sync.core.alarm;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.support.InMemoryStateStore;
import com.skyreader.sync.support.MutableClock;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

class AlarmDriverTest {

    private final InMemoryStateStore state = new InMemoryStateStore();
    private final MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
    private final Alarms alarms = new Alarms(state, clock);

    private static final Duration LEASE = Duration.ofMinutes(10);

    @Test
    void firesDueHandlersOnly() {
        CountingHandler due = new CountingHandler("due", Mono.empty());
        CountingHandler later = new CountingHandler("later", Mono.empty());
        AlarmDriver driver = new AlarmDriver(List.of(due, later), alarms, clock, Duration.ofSeconds(1), LEASE);

        alarms.setIn("due", Duration.ZERO).block();
        alarms.setIn("later", Duration.ofMinutes(1)).block();
        driver.fireDue().block();

        assertThat(due.calls.get()).isEqualTo(1);
        assertThat(later.calls.get()).isZero();
        assertThat(alarms.get("due").block()).isEqualTo(clock.instant().plus(LEASE));
        assertThat(alarms.get("later").block()).isNotNull();
    }

    @Test
    void handlerIsNotStartedTwiceWhileRunning() {
        Sinks.Empty<Void> release = Sinks.empty();
        CountingHandler slow = new CountingHandler("slow", release.asMono());
        AlarmDriver driver = new AlarmDriver(List.of(slow), alarms, clock, Duration.ofSeconds(1), LEASE);

        alarms.setIn("slow", Duration.ZERO).block();
        driver.fireDue().block();
        alarms.setIn("slow", Duration.ZERO).block();
        driver.fireDue().block();

        assertThat(slow.calls.get()).isEqualTo(1);
        assertThat(alarms.get("slow").block()).as("second alarm stays pending").isNotNull();

        release.tryEmitEmpty();
        driver.fireDue().block();
        assertThat(slow.calls.get()).isEqualTo(2);
    }

    @Test
    void failingHandlerDoesNotStopOthers() {
        CountingHandler broken = new CountingHandler("broken", Mono.error(new IllegalStateException("boom")));
        CountingHandler fine = new CountingHandler("fine", Mono.empty());
        AlarmDriver driver = new AlarmDriver(List.of(broken, fine), alarms, clock, Duration.ofSeconds(1), LEASE);

        alarms.setIn("broken", Duration.ZERO).block();
        alarms.setIn("fine", Duration.ZERO).block();
        driver.fireDue().block();

        assertThat(broken.calls.get()).isEqualTo(1);
        assertThat(fine.calls.get()).isEqualTo(1);
    }

    @Test
    void handlerThatNeverReschedulesFiresAgainAfterTheLease() {
        CountingHandler forgetful = new CountingHandler("forgetful", Mono.error(new IllegalStateException("lost")));
        AlarmDriver driver = new AlarmDriver(List.of(forgetful), alarms, clock, Duration.ofSeconds(1), LEASE);

        alarms.setIn("forgetful", Duration.ZERO).block();
        driver.fireDue().block();
        clock.advance(LEASE.minusSeconds(1));
        driver.fireDue().block();
        assertThat(forgetful.calls.get()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        driver.fireDue().block();
        assertThat(forgetful.calls.get()).isEqualTo(2);
    }

    @Test
    void clearedAlarmStaysQuiet() {
        CountingHandler oneShot = new CountingHandler("one-shot", Mono.defer(() -> alarms.clear("one-shot")));
        AlarmDriver driver = new AlarmDriver(List.of(oneShot), alarms, clock, Duration.ofSeconds(1), LEASE);

        alarms.setIn("one-shot", Duration.ZERO).block();
        driver.fireDue().block();
        clock.advance(LEASE.multipliedBy(3));
        driver.fireDue().block();

        assertThat(oneShot.calls.get()).isEqualTo(1);
        assertThat(alarms.get("one-shot").block()).isNull();
    }

    private static final class CountingHandler implements AlarmHandler {

        private final String name;
        private final Mono<Void> work;
        private final AtomicInteger calls = new AtomicInteger();

        CountingHandler(String name, Mono<Void> work) {
            this.name = name;
            this.work = work;
        }

        @Override
        public String alarmName() {
            return name;
        }

        @Override
        public Mono<Void> onAlarm() {
            calls.incrementAndGet();
            return work;
        }
    }
}
