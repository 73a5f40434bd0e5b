package com.skyreader.sync.poller;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.cursor.CursorStore;
import com.skyreader.sync.core.model.EventKind;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.store.UserStore;
import com.skyreader.sync.ingest.CommitProcessors;
import com.skyreader.sync.jetstream.client.EventStreamClient;
import com.skyreader.sync.jetstream.client.StreamRequest;
import com.skyreader.sync.jetstream.client.StreamSession;
import com.skyreader.sync.jetstream.config.JetstreamProperties;

import reactor.core.publisher.Mono;

/**
 * Drains one {@link LogicalStream} from its stored cursor until the stream is idle or the hard timeout hits.
 *
 * <ul>
 *   <li>Events are applied one at a time, in arrival order.</li>
 *   <li>A failing event is counted and logged; it never stops the drain.</li>
 *   <li>The cursor is written once the drain ends, whatever the outcome, to the furthest stream time
 *       seen (or the live-tail baseline when nothing arrived). It never depends on event success.</li>
 * </ul>
 */
@Component
public class StreamPoller {

    private static final Logger log = LoggerFactory.getLogger(StreamPoller.class);

    private final EventStreamClient client;
    private final CommitProcessors processors;
    private final CursorStore cursors;
    private final UserStore users;
    private final JetstreamProperties props;
    private final Clock clock;

    public StreamPoller(EventStreamClient client, CommitProcessors processors, CursorStore cursors, UserStore users,
            JetstreamProperties props, Clock clock) {
        this.client = client;
        this.processors = processors;
        this.cursors = cursors;
        this.users = users;
        this.props = props;
        this.clock = clock;
    }

    public Mono<StreamCycleStats> poll(LogicalStream stream) {
        if (!stream.activeUsersOnly()) {
            return drain(stream, List.of());
        }
        JetstreamProperties.Poller poller = props.getPoller();
        Instant since = clock.instant().minus(poller.getActiveWindow());
        return users.activeDids(since, poller.getMaxWantedDids())
                .collectList()
                .flatMap(dids -> {
                    if (dids.isEmpty()) {
                        log.debug("No active users; skipping {} stream", stream);
                        return Mono.just(StreamCycleStats.EMPTY);
                    }
                    return drain(stream, dids);
                });
    }

    private Mono<StreamCycleStats> drain(LogicalStream stream, List<String> wantedDids) {
        JetstreamProperties.Poller poller = props.getPoller();
        return cursors.get(stream.cursorKey())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(stored -> {
                    StreamSession session = client.open(StreamRequest.bounded(List.of(stream.collection()),
                            wantedDids, stored.orElse(null), poller.getIdleTimeout(), poller.getHardTimeout()));

                    AtomicInteger processed = new AtomicInteger();
                    AtomicInteger errors = new AtomicInteger();

                    return session.events()
                            .concatMap(event -> apply(stream, event, processed, errors))
                            .then(Mono.defer(() -> cursors.put(stream.cursorKey(), session.resumeToken())))
                            .then(Mono.fromCallable(() -> {
                                log.debug("Stream {} drained processed={} errors={} cursor={}", stream,
                                        processed.get(), errors.get(), session.resumeToken());
                                return new StreamCycleStats(processed.get(), errors.get());
                            }));
                });
    }

    private Mono<Void> apply(LogicalStream stream, JetstreamEvent event, AtomicInteger processed,
            AtomicInteger errors) {
        if (event.kind() == EventKind.MALFORMED) {
            errors.incrementAndGet();
            return Mono.empty();
        }
        if (event.watchedCollection().filter(c -> c == stream.collection()).isEmpty()) {
            return Mono.empty();
        }
        return processors.process(event)
                .doOnNext(outcome -> processed.incrementAndGet())
                .onErrorResume(err -> {
                    errors.incrementAndGet();
                    log.warn("Event failed stream={} did={} time_us={} err={}", stream, event.did(),
                            event.timeUs(), err.toString());
                    return Mono.empty();
                })
                .then();
    }
}
