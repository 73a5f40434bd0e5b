package com.skyreader.sync.jetstream.client;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.cursor.CursorTokens;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.jetstream.codec.JetstreamEventDecoder;
import com.skyreader.sync.jetstream.config.JetstreamProperties;
import com.skyreader.sync.jetstream.subscribe.SubscribeUri;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Opens firehose subscriptions and turns them into bounded, never-failing event streams.
 *
 * <h2>Resume position</h2>
 * <ul>
 *   <li>With a resume token, the subscription starts {@code overlap} earlier so frames redelivered across a
 *       reconnect are replayed instead of lost. Consumers must be idempotent.</li>
 *   <li>Without one, the subscription has no cursor (live tail) and the session's token starts at "now".</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * Whichever comes first: no frame for {@code idleTimeout}, {@code hardTimeout} elapsed, server close, or a
 * transport/connect error. All four complete the stream normally; errors are logged, never retried here.
 * Closing happens by cancelling the transport, which closes the socket.
 */
@Component
public class EventStreamClient {

    private static final Logger log = LoggerFactory.getLogger(EventStreamClient.class);

    /** Extra time granted to the first frame to cover the TLS/WebSocket handshake. */
    private static final Duration CONNECT_ALLOWANCE = Duration.ofSeconds(3);

    private final JetstreamTransport transport;
    private final JetstreamEventDecoder decoder;
    private final JetstreamProperties props;
    private final Clock clock;

    public EventStreamClient(JetstreamTransport transport, JetstreamEventDecoder decoder, JetstreamProperties props,
            Clock clock) {
        this.transport = transport;
        this.decoder = decoder;
        this.props = props;
        this.clock = clock;
    }

    public StreamSession open(StreamRequest request) {
        Long resume = request.resumeToken();
        long start = resume != null ? resume : CursorTokens.baseline(clock);

        SubscribeUri subscription = SubscribeUri.builder()
                .endpoint(props.getEndpoint())
                .collections(request.collections())
                .wantedDids(request.wantedDids())
                .cursor(resume == null ? null : CursorTokens.withOverlap(resume, props.getOverlap()))
                .build();
        URI uri = subscription.toUri();

        AtomicLong latest = new AtomicLong(start);

        Flux<String> frames = Flux.defer(() -> {
            log.debug("Opening firehose subscription {}", subscription);
            return transport.frames(uri);
        });

        Duration idle = request.idleTimeout();
        if (idle != null) {
            frames = frames
                    .timeout(Mono.delay(idle.plus(CONNECT_ALLOWANCE)), frame -> Mono.delay(idle))
                    .onErrorResume(TimeoutException.class, e -> {
                        log.debug("Firehose idle for {}; treating stream as caught up", idle);
                        return Flux.empty();
                    });
        }
        if (request.hardTimeout() != null) {
            frames = frames.take(request.hardTimeout());
        }

        Flux<JetstreamEvent> events = frames
                .onErrorResume(err -> {
                    log.warn("Firehose transport ended with error collections={} err={}",
                            subscription.collections(), err.toString());
                    return Flux.empty();
                })
                .map(decoder::decode)
                .doOnNext(event -> {
                    if (event.timeUs() != null) {
                        latest.accumulateAndGet(event.timeUs(), Math::max);
                    }
                });

        return new StreamSession(events, start, latest);
    }
}
