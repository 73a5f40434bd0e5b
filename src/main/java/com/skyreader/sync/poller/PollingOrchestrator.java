package com.skyreader.sync.poller;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.cursor.CursorStore;
import com.skyreader.sync.core.store.StateStore;
import com.skyreader.sync.jetstream.config.JetstreamProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Periodic bounded poll of every {@link LogicalStream}.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>Streams are drained one after another, never concurrently.</li>
 *   <li>A stream that fails as a whole is logged and recorded as empty; the next stream still runs.</li>
 *   <li>Statistics are stored under {@code last_stats} (best effort).</li>
 *   <li>The next cycle is scheduled {@code interval} after this one ends. This step runs whatever happened
 *       before it, so a bad cycle cannot stop the poller.</li>
 * </ol>
 */
@Component
public class PollingOrchestrator implements AlarmHandler {

    private static final Logger log = LoggerFactory.getLogger(PollingOrchestrator.class);

    public static final String ALARM = "jetstream-poller";

    static final String STATS_KEY = "last_stats";

    private static final Duration START_DELAY = Duration.ofMillis(100);

    private final StreamPoller poller;
    private final CursorStore cursors;
    private final StateStore state;
    private final Alarms alarms;
    private final JetstreamProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public PollingOrchestrator(StreamPoller poller, CursorStore cursors, StateStore state, Alarms alarms,
            JetstreamProperties props, ObjectMapper mapper, Clock clock) {
        this.poller = poller;
        this.cursors = cursors;
        this.state = state;
        this.alarms = alarms;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String alarmName() {
        return ALARM;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        if (!props.getPoller().isAutoStart()) {
            log.info("Jetstream poller auto-start disabled");
            return;
        }
        start().subscribe(
                status -> log.info("Jetstream poller {}", status),
                err -> log.warn("Could not schedule jetstream poller err={}", err.toString()));
    }

    /**
     * Schedules an immediate cycle unless one is already scheduled.
     *
     * @return {@code started} or {@code already_scheduled}
     */
    public Mono<String> start() {
        return alarms.setIfAbsent(ALARM, START_DELAY).map(scheduled -> scheduled ? "started" : "already_scheduled");
    }

    @Override
    public Mono<Void> onAlarm() {
        return Mono.defer(() -> {
            running.set(true);
            Instant started = clock.instant();
            log.info("Poll cycle starting");

            Map<LogicalStream, StreamCycleStats> results = new LinkedHashMap<>();
            return Flux.fromArray(LogicalStream.values())
                    .concatMap(stream -> poller.poll(stream)
                            .onErrorResume(err -> {
                                log.warn("Stream {} poll failed err={}", stream, err.toString());
                                return Mono.just(StreamCycleStats.EMPTY);
                            })
                            .doOnNext(stats -> results.put(stream, stats)))
                    .then(Mono.defer(() -> saveStats(started, results)))
                    .onErrorResume(err -> {
                        log.error("Poll cycle failed err={}", err.toString());
                        return Mono.empty();
                    })
                    .then(Mono.defer(() -> alarms.setIn(ALARM, props.getPoller().getInterval())))
                    .doFinally(sig -> running.set(false));
        });
    }

    private Mono<Void> saveStats(Instant started, Map<LogicalStream, StreamCycleStats> results) {
        Instant now = clock.instant();
        PollStats stats = new PollStats(
                results.getOrDefault(LogicalStream.SHARES, StreamCycleStats.EMPTY),
                results.getOrDefault(LogicalStream.FOLLOWS, StreamCycleStats.EMPTY),
                results.getOrDefault(LogicalStream.INAPP_FOLLOWS, StreamCycleStats.EMPTY),
                Duration.between(started, now).toMillis(),
                started);

        log.info("Poll complete shares={}/{} follows={}/{} inappFollows={}/{} durationMs={}",
                stats.shares().processed(), stats.shares().errors(),
                stats.follows().processed(), stats.follows().errors(),
                stats.inappFollows().processed(), stats.inappFollows().errors(),
                stats.durationMs());

        try {
            return state.put(STATS_KEY, mapper.writeValueAsString(stats))
                    .onErrorResume(err -> {
                        log.warn("Could not save poll stats err={}", err.toString());
                        return Mono.empty();
                    });
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize poll stats err={}", e.getOriginalMessage());
            return Mono.empty();
        }
    }

    public Mono<PollerStatus> status() {
        Mono<Map<String, Long>> cursorMap = Flux.fromArray(LogicalStream.values())
                .concatMap(stream -> cursors.get(stream.cursorKey())
                        .map(token -> Map.entry(stream.cursorKey(), token)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);

        Mono<Optional<PollStats>> stats = state.get(STATS_KEY)
                .flatMap(json -> {
                    try {
                        return Mono.just(mapper.readValue(json, PollStats.class));
                    } catch (JsonProcessingException e) {
                        log.warn("Unreadable poll stats err={}", e.getOriginalMessage());
                        return Mono.empty();
                    }
                })
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());

        Mono<Optional<Instant>> next = alarms.get(ALARM).map(Optional::of).defaultIfEmpty(Optional.empty());

        return Mono.zip(cursorMap, stats, next)
                .map(t -> new PollerStatus(t.getT1(), t.getT2().orElse(null), t.getT3().orElse(null),
                        t.getT3().isPresent(), running.get()));
    }

    /**
     * @param cursors   stored resume token per cursor key
     * @param scheduled a next cycle is pending
     * @param polling   a cycle is executing in this process right now
     */
    public record PollerStatus(Map<String, Long> cursors, PollStats lastStats, Instant nextPoll, boolean scheduled,
            boolean polling) {
    }
}
