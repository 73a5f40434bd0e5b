package com.skyreader.sync.poller;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.core.alarm.AlarmDriver;
import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.cursor.StateCursorStore;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.WatchedCollection;
import com.skyreader.sync.ingest.CommitOutcome;
import com.skyreader.sync.ingest.CommitProcessor;
import com.skyreader.sync.ingest.CommitProcessors;
import com.skyreader.sync.jetstream.client.EventStreamClient;
import com.skyreader.sync.jetstream.codec.JetstreamEventDecoder;
import com.skyreader.sync.jetstream.config.JetstreamProperties;
import com.skyreader.sync.support.Frames;
import com.skyreader.sync.support.InMemoryStateStore;
import com.skyreader.sync.support.InMemoryUserStore;
import com.skyreader.sync.support.MutableClock;
import com.skyreader.sync.support.ScriptedTransport;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class PollingOrchestratorTest {

    private final MutableClock clock = MutableClock.at("2026-10-01T00:00:00Z");
    private final ScriptedTransport transport = new ScriptedTransport();
    private final InMemoryStateStore state = new InMemoryStateStore();
    private final StateCursorStore cursors = new StateCursorStore(state);
    private final Alarms alarms = new Alarms(state, clock);
    private final JetstreamProperties props = new JetstreamProperties();

    private PollingOrchestrator orchestrator() {
        props.getPoller().setIdleTimeout(Duration.ofMillis(100));
        CommitProcessor shares = new CommitProcessor() {
            @Override
            public WatchedCollection collection() {
                return WatchedCollection.SHARE;
            }

            @Override
            public Mono<CommitOutcome> process(JetstreamEvent event) {
                return Mono.just(CommitOutcome.UPSERTED);
            }
        };
        EventStreamClient client = new EventStreamClient(transport, new JetstreamEventDecoder(Frames.MAPPER), props,
                clock);
        StreamPoller poller = new StreamPoller(client, new CommitProcessors(List.of(shares)), cursors,
                new InMemoryUserStore(), props, clock);
        return new PollingOrchestrator(poller, cursors, state, alarms, props, Frames.MAPPER, clock);
    }

    @Test
    void startIsIdempotent() {
        PollingOrchestrator orchestrator = orchestrator();

        StepVerifier.create(orchestrator.start()).expectNext("started").verifyComplete();
        StepVerifier.create(orchestrator.start()).expectNext("already_scheduled").verifyComplete();
    }

    @Test
    void cycleStoresStatsCursorsAndReschedules() {
        PollingOrchestrator orchestrator = orchestrator();
        transport.then(Frames.shareCreate("did:plc:a", "1", 500L, "https://x.example/1"));

        orchestrator.onAlarm().block();

        assertThat(alarms.get(PollingOrchestrator.ALARM).block())
                .isEqualTo(clock.instant().plus(props.getPoller().getInterval()));
        StepVerifier.create(orchestrator.status())
                .assertNext(status -> {
                    assertThat(status.scheduled()).isTrue();
                    assertThat(status.polling()).isFalse();
                    assertThat(status.cursors()).containsEntry("cursor_shares", 500L)
                            .containsKey("cursor_inapp_follows")
                            .doesNotContainKey("cursor_follows");
                    assertThat(status.lastStats().shares()).isEqualTo(new StreamCycleStats(1, 0));
                    assertThat(status.lastStats().lastPollAt()).isEqualTo(Instant.parse("2026-10-01T00:00:00Z"));
                })
                .verifyComplete();
    }

    @Test
    void reschedulesEvenWhenStorageFails() {
        InMemoryStateStore broken = new InMemoryStateStore() {
            @Override
            public Mono<Void> put(String key, String value) {
                if (key.startsWith("alarm:")) {
                    return super.put(key, value);
                }
                return Mono.error(new IllegalStateException("disk full"));
            }
        };
        Alarms brokenAlarms = new Alarms(broken, clock);
        StateCursorStore brokenCursors = new StateCursorStore(broken);
        EventStreamClient client = new EventStreamClient(transport, new JetstreamEventDecoder(Frames.MAPPER), props,
                clock);
        props.getPoller().setIdleTimeout(Duration.ofMillis(100));
        StreamPoller poller = new StreamPoller(client, new CommitProcessors(List.of()), brokenCursors,
                new InMemoryUserStore(), props, clock);
        PollingOrchestrator orchestrator = new PollingOrchestrator(poller, brokenCursors, broken, brokenAlarms, props,
                Frames.MAPPER, clock);

        StepVerifier.create(orchestrator.onAlarm()).verifyComplete();
        assertThat(brokenAlarms.get(PollingOrchestrator.ALARM).block()).isNotNull();
    }

    @Test
    void failedRescheduleIsPickedUpAgainAfterTheLeaseWindow() throws InterruptedException {
        AtomicInteger alarmWrites = new AtomicInteger();
        InMemoryStateStore flaky = new InMemoryStateStore() {
            @Override
            public Mono<Void> put(String key, String value) {
                if (key.equals("alarm:" + PollingOrchestrator.ALARM) && alarmWrites.incrementAndGet() == 2) {
                    return Mono.error(new IllegalStateException("connection reset"));
                }
                return super.put(key, value);
            }
        };
        Alarms flakyAlarms = new Alarms(flaky, clock);
        StateCursorStore flakyCursors = new StateCursorStore(flaky);
        props.getPoller().setIdleTimeout(Duration.ofMillis(100));
        EventStreamClient client = new EventStreamClient(transport, new JetstreamEventDecoder(Frames.MAPPER), props,
                clock);
        StreamPoller poller = new StreamPoller(client, new CommitProcessors(List.of()), flakyCursors,
                new InMemoryUserStore(), props, clock);
        PollingOrchestrator orchestrator = new PollingOrchestrator(poller, flakyCursors, flaky, flakyAlarms, props,
                Frames.MAPPER, clock);

        AtomicInteger cycles = new AtomicInteger();
        Semaphore finished = new Semaphore(0);
        AlarmHandler counted = new AlarmHandler() {
            @Override
            public String alarmName() {
                return orchestrator.alarmName();
            }

            @Override
            public Mono<Void> onAlarm() {
                cycles.incrementAndGet();
                return orchestrator.onAlarm().doFinally(sig -> finished.release());
            }
        };
        AlarmDriver driver = new AlarmDriver(List.of(counted), flakyAlarms, clock, Duration.ofSeconds(1),
                Duration.ofMinutes(10));

        orchestrator.start().block();
        for (int tick = 1; tick <= 10; tick++) {
            clock.advance(Duration.ofMinutes(5));
            int before = cycles.get();
            driver.fireDue().block();
            if (cycles.get() > before) {
                assertThat(finished.tryAcquire(5, TimeUnit.SECONDS)).as("cycle at tick %d finished", tick).isTrue();
            }
        }

        // first cycle lost its reschedule; the lease slot brought it back at minute 15, then every tick
        assertThat(cycles.get()).isEqualTo(9);
        assertThat(flakyAlarms.get(PollingOrchestrator.ALARM).block())
                .isEqualTo(clock.instant().plus(props.getPoller().getInterval()));
    }
}
