package com.skyreader.sync.consumer;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.cursor.CursorStore;
import com.skyreader.sync.core.lease.InstanceLease;
import com.skyreader.sync.core.model.EventKind;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.WatchedCollection;
import com.skyreader.sync.ingest.CommitProcessors;
import com.skyreader.sync.jetstream.client.EventStreamClient;
import com.skyreader.sync.jetstream.client.StreamRequest;
import com.skyreader.sync.jetstream.config.JetstreamProperties;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

/**
 * Long-lived firehose subscription for shares and graph follows of the watched identities.
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Starts after the application is ready: claims the active-instance lease, loads the watched set,
 *       connects and arms the keepalive alarm.</li>
 *   <li>The cursor ({@code jetstream_cursor}) is written after every applied event and replayed with the
 *       configured overlap on reconnect.</li>
 *   <li>When the stream ends for any reason other than a local disconnect, it reconnects after
 *       {@code reconnectDelay}.</li>
 *   <li>The keepalive alarm is per instance ({@code jetstream-live-keepalive:<instanceId>}). It refreshes the
 *       lease and reconnects if needed. If another instance holds the lease, this one disconnects and clears
 *       its alarm.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "skyreader.jetstream.live", name = "enabled", havingValue = "true")
public class LiveCommitConsumer implements AlarmHandler, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LiveCommitConsumer.class);

    public static final String ALARM = "jetstream-live-keepalive";

    static final String CURSOR_KEY = "jetstream_cursor";

    static final List<WatchedCollection> COLLECTIONS = List.of(WatchedCollection.SHARE,
            WatchedCollection.GRAPH_FOLLOW);

    private final EventStreamClient client;
    private final CommitProcessors processors;
    private final CursorStore cursors;
    private final WatchedIdentitySet watched;
    private final InstanceLease lease;
    private final Alarms alarms;
    private final JetstreamProperties.Live props;

    private final String instanceId = UUID.randomUUID().toString();
    private final String alarmName = ALARM + ":" + instanceId;

    private final Object lock = new Object();
    private Disposable connection;
    private Disposable pendingReconnect;

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean replaced = new AtomicBoolean(false);
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public LiveCommitConsumer(EventStreamClient client, CommitProcessors processors, CursorStore cursors,
            WatchedIdentitySet watched, InstanceLease lease, Alarms alarms, JetstreamProperties props) {
        this.client = client;
        this.processors = processors;
        this.cursors = cursors;
        this.watched = watched;
        this.lease = lease;
        this.alarms = alarms;
        this.props = props.getLive();
    }

    @Override
    public String alarmName() {
        return alarmName;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        lease.claim(instanceId)
                .doOnSuccess(v -> log.info("Registered as active live consumer instance={}", instanceId))
                .then(watched.load())
                .then(Mono.fromRunnable(this::connect))
                .then(alarms.setIn(alarmName, props.getKeepalive()))
                .subscribe(
                        v -> { },
                        err -> log.error("Live consumer failed to start: {}", err.toString(), err));
    }

    /**
     * Lease check, lease refresh and connection repair.
     */
    @Override
    public Mono<Void> onAlarm() {
        return lease.holder()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(holder -> {
                    if (holder.isPresent() && !holder.get().equals(instanceId)) {
                        log.info("Live consumer replaced by instance={}; shutting down", holder.get());
                        replaced.set(true);
                        stopped.set(true);
                        disconnect();
                        return alarms.clear(alarmName);
                    }
                    return lease.claim(instanceId)
                            .then(Mono.fromRunnable(this::connect))
                            .then(alarms.setIn(alarmName, props.getKeepalive()));
                });
    }

    /**
     * Adds an identity to the filter and reconnects so the new filter takes effect. The cursor overlap
     * covers the reconnect gap.
     */
    public Mono<WatchedIdentitySet.AddResult> registerDid(String did) {
        return watched.add(did).doOnNext(result -> {
            if (result == WatchedIdentitySet.AddResult.ADDED) {
                log.info("Watching did={} total={}", did, watched.size());
                reconnect();
            }
        });
    }

    public void reconnect() {
        disconnect();
        connect();
    }

    public Mono<LiveStatus> status() {
        return lease.holder().defaultIfEmpty("").map(this::status);
    }

    private LiveStatus status(String leaseHolder) {
        return new LiveStatus(isConnected(), watched.size(), instanceId, instanceId.equals(leaseHolder),
                replaced.get(), applied.get(), failed.get());
    }

    public boolean isConnected() {
        synchronized (lock) {
            return connection != null && !connection.isDisposed();
        }
    }

    void connect() {
        if (stopped.get()) {
            return;
        }
        synchronized (lock) {
            if (connection != null && !connection.isDisposed()) {
                return;
            }
            log.info("Connecting live subscription watched={}", watched.size());
            connection = stream()
                    .doFinally(this::onClosed)
                    .subscribe(
                            v -> { },
                            err -> log.error("Live subscription terminated unexpectedly: {}", err.toString(), err));
        }
    }

    private Flux<Void> stream() {
        return cursors.get(CURSOR_KEY)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMapMany(resume -> client
                        .open(StreamRequest.unbounded(COLLECTIONS, watched.snapshot(), resume.orElse(null)))
                        .events())
                .concatMap(this::apply);
    }

    private Mono<Void> apply(JetstreamEvent event) {
        if (event.kind() == EventKind.MALFORMED) {
            failed.incrementAndGet();
            log.warn("Malformed live frame skipped");
            return Mono.empty();
        }
        Mono<Void> work = event.watchedCollection().isPresent()
                ? processors.process(event)
                        .doOnNext(outcome -> applied.incrementAndGet())
                        .onErrorResume(err -> {
                            failed.incrementAndGet();
                            log.warn("Live event failed did={} time_us={} err={}", event.did(), event.timeUs(),
                                    err.toString());
                            return Mono.empty();
                        })
                        .then()
                : Mono.empty();

        if (event.timeUs() == null) {
            return work;
        }
        return work.then(cursors.put(CURSOR_KEY, event.timeUs())
                .onErrorResume(err -> {
                    log.warn("Live cursor write failed err={}", err.toString());
                    return Mono.empty();
                }));
    }

    private void onClosed(SignalType signal) {
        if (signal == SignalType.CANCEL) {
            return;
        }
        log.info("Live subscription closed signal={}", signal);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (stopped.get()) {
            return;
        }
        synchronized (lock) {
            if (pendingReconnect != null && !pendingReconnect.isDisposed()) {
                return;
            }
            Duration delay = props.getReconnectDelay();
            pendingReconnect = Mono.delay(delay).subscribe(t -> connect());
        }
    }

    void disconnect() {
        synchronized (lock) {
            if (pendingReconnect != null) {
                pendingReconnect.dispose();
                pendingReconnect = null;
            }
            if (connection != null) {
                connection.dispose();
                connection = null;
            }
        }
    }

    @Override
    public void destroy() {
        stopped.set(true);
        disconnect();
    }

    /**
     * @param activeInstance this instance holds the lease
     * @param replaced       another instance took over and this one stopped
     */
    public record LiveStatus(boolean connected, int watchedDids, String instanceId, boolean activeInstance,
            boolean replaced, long applied, long failed) {
    }
}
