package com.skyreader.sync.realtime.hub;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.model.NotificationType;
import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.core.store.FollowStore;
import com.skyreader.sync.core.store.SubscriptionStore;
import com.skyreader.sync.realtime.config.RealtimeProperties;

import reactor.core.publisher.Mono;

/**
 * Fan-out point for realtime notifications to connected readers.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@code new_share}: connections whose identity currently follows the author (Bluesky or in-app).</li>
 *   <li>{@code new_articles}: connections whose identity is subscribed to the feed.</li>
 *   <li>anything else: every connection.</li>
 * </ul>
 * The follow and subscription relations are read at broadcast time, so a follow made after a reader connected
 * is honored without reconnecting.
 *
 * <h2>Liveness</h2>
 * The heartbeat alarm probes every connection, closes the ones that stopped answering and reschedules itself
 * while connections remain. Connections live in this process, so each hub owns its own alarm
 * ({@code realtime-heartbeat:<instanceId>}). After {@code hibernateAfter} without activity the in-memory index
 * is dropped; it is rebuilt from the socket attachments the next time anything touches the hub.
 */
@Component
public class RealtimeHub implements AlarmHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeHub.class);

    public static final String ALARM = "realtime-heartbeat";

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_INTERNAL_ERROR = 1011;

    private final FollowStore follows;
    private final SubscriptionStore subscriptions;
    private final SocketRegistry registry;
    private final Alarms alarms;
    private final RealtimeProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final String alarmName = ALARM + ":" + UUID.randomUUID();

    // guards the awake flag together with the index: hibernate, wake-up and register
    private final Object lock = new Object();
    private final Map<String, ConnectionRecord> connections = new ConcurrentHashMap<>();
    private volatile boolean awake = true;
    private volatile Instant lastActivity;

    public RealtimeHub(
            FollowStore follows,
            SubscriptionStore subscriptions,
            SocketRegistry registry,
            Alarms alarms,
            RealtimeProperties props,
            ObjectMapper mapper,
            Clock clock
    ) {
        this.follows = follows;
        this.subscriptions = subscriptions;
        this.registry = registry;
        this.alarms = alarms;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    @Override
    public String alarmName() {
        return alarmName;
    }

    /**
     * Accepts an authenticated connection: persists its attachment, indexes it, greets it and makes sure the
     * heartbeat alarm is armed.
     */
    public Mono<Void> register(HubSocket socket, UserSession session) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            ConnectionRecord record = new ConnectionRecord(socket, session.did(), now);
            socket.attach(record.attachment().encode(mapper));
            synchronized (lock) {
                ensureAwake();
                registry.add(socket);
                connections.put(socket.id(), record);
                touch(now);
            }

            socket.send(timestamped(NotificationType.CONNECTED, now));
            log.debug("Realtime connection opened id={} did={}", socket.id(), session.did());

            return alarms.setIfAbsent(alarmName, props.getHeartbeatInterval()).then();
        });
    }

    /**
     * Handles an inbound text frame. Only {@code pong} has an effect; other or unparseable frames are ignored.
     */
    public void onMessage(HubSocket socket, String text) {
        ensureAwake();
        ConnectionRecord record = connections.get(socket.id());
        if (record == null) {
            return;
        }
        String type;
        try {
            JsonNode node = mapper.readTree(text);
            type = node.path("type").asText("");
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable frame id={}", socket.id());
            return;
        }
        if (NotificationType.PONG.wire().equals(type)) {
            Instant now = clock.instant();
            record.heartbeat(now);
            socket.attach(record.attachment().encode(mapper));
            touch(now);
        }
    }

    public void onClose(HubSocket socket) {
        connections.remove(socket.id());
        registry.remove(socket.id());
        log.debug("Realtime connection closed id={}", socket.id());
    }

    /**
     * Routes a message to its audience.
     *
     * @return the number of connections the frame was queued on
     */
    public Mono<Integer> broadcast(RealtimeMessage message) {
        return Mono.defer(() -> {
            ensureAwake();
            touch(clock.instant());
            String frame = encode(message);
            if (connections.isEmpty()) {
                return Mono.just(0);
            }

            String type = message.type();
            if (NotificationType.NEW_SHARE.wire().equals(type)) {
                String author = message.payloadText("authorDid");
                if (author == null) {
                    return Mono.just(0);
                }
                return follows.followersOf(author).collect(HashSet<String>::new, Set::add)
                        .map(audience -> deliver(frame, r -> audience.contains(r.did())));
            }
            if (NotificationType.NEW_ARTICLES.wire().equals(type)) {
                String feedUrl = message.payloadText("feedUrl");
                if (feedUrl == null) {
                    return Mono.just(0);
                }
                return subscriptions.subscribersOf(feedUrl).collect(HashSet<String>::new, Set::add)
                        .map(audience -> deliver(frame, r -> audience.contains(r.did())));
            }
            return Mono.just(deliver(frame, r -> true));
        });
    }

    @Override
    public Mono<Void> onAlarm() {
        return Mono.defer(() -> {
            ensureAwake();
            Instant now = clock.instant();

            for (ConnectionRecord record : List.copyOf(connections.values())) {
                if (now.isAfter(record.lastHeartbeat().plus(props.getHeartbeatTimeout()))) {
                    log.info("Closing stale realtime connection id={} did={}", record.socket().id(), record.did());
                    record.socket().close(CLOSE_NORMAL, "Heartbeat timeout");
                    drop(record);
                }
            }

            int probed = deliver(timestamped(NotificationType.HEARTBEAT, now), r -> true);
            log.debug("Heartbeat sent connections={}", probed);

            if (!lastActivity.plus(props.getHibernateAfter()).isAfter(now)) {
                hibernate();
            }
            if (!idle()) {
                return alarms.setIn(alarmName, props.getHeartbeatInterval());
            }
            // a register racing with the clear has either been seen here or re-arms after it
            return alarms.clear(alarmName)
                    .then(Mono.defer(() -> idle()
                            ? Mono.<Void>empty()
                            : alarms.setIn(alarmName, props.getHeartbeatInterval())));
        });
    }

    public int connectedCount() {
        ensureAwake();
        return connections.size();
    }

    /**
     * Drops the in-memory index. Open sockets stay with the registry and keep their attachments.
     */
    void hibernate() {
        synchronized (lock) {
            if (!awake) {
                return;
            }
            connections.clear();
            awake = false;
        }
        log.info("Realtime hub hibernating openSockets={}", registry.size());
    }

    boolean isAwake() {
        return awake;
    }

    /**
     * Rebuilds the index from socket attachments after hibernation. Sockets whose attachment cannot be read
     * are closed.
     */
    void ensureAwake() {
        if (awake) {
            return;
        }
        int restored = 0;
        synchronized (lock) {
            if (awake) {
                return;
            }
            for (HubSocket socket : registry.open()) {
                var attachment = ConnectionAttachment.decode(mapper, socket.attachment());
                if (attachment.isEmpty()) {
                    log.warn("Closing connection with unreadable state id={}", socket.id());
                    socket.close(CLOSE_INTERNAL_ERROR, "Unreadable connection state");
                    registry.remove(socket.id());
                    continue;
                }
                ConnectionAttachment a = attachment.get();
                connections.put(socket.id(), new ConnectionRecord(socket, a.did(), a.lastHeartbeat()));
                restored++;
            }
            touch(clock.instant());
            awake = true;
        }
        log.info("Realtime hub woke up restored={}", restored);
    }

    private boolean idle() {
        return connections.isEmpty() && registry.size() == 0;
    }

    private int deliver(String frame, Predicate<ConnectionRecord> audience) {
        int delivered = 0;
        for (ConnectionRecord record : List.copyOf(connections.values())) {
            if (!audience.test(record)) {
                continue;
            }
            if (record.socket().isOpen() && record.socket().send(frame)) {
                delivered++;
            } else {
                log.warn("Dropping realtime connection after failed send id={}", record.socket().id());
                drop(record);
            }
        }
        return delivered;
    }

    private void drop(ConnectionRecord record) {
        connections.remove(record.socket().id());
        registry.remove(record.socket().id());
    }

    private void touch(Instant at) {
        lastActivity = at;
    }

    private String timestamped(NotificationType type, Instant now) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("timestamp", now.toEpochMilli());
        return encode(RealtimeMessage.of(type, payload));
    }

    private String encode(RealtimeMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", message.type());
        node.set("payload", message.payload());
        return node.toString();
    }
}
