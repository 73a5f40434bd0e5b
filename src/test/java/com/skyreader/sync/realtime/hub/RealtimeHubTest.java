package com.skyreader.sync.realtime.hub;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.model.NotificationType;
import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.realtime.config.RealtimeProperties;
import com.skyreader.sync.support.FakeHubSocket;
import com.skyreader.sync.support.Frames;
import com.skyreader.sync.support.InMemoryFollowStore;
import com.skyreader.sync.support.InMemoryStateStore;
import com.skyreader.sync.support.InMemorySubscriptionStore;
import com.skyreader.sync.support.MutableClock;

import reactor.test.StepVerifier;

class RealtimeHubTest {

    private final MutableClock clock = MutableClock.at("2026-10-01T12:00:00Z");
    private final InMemoryFollowStore follows = new InMemoryFollowStore();
    private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
    private final SocketRegistry registry = new SocketRegistry();
    private final InMemoryStateStore state = new InMemoryStateStore();
    private final Alarms alarms = new Alarms(state, clock);
    private final RealtimeProperties props = new RealtimeProperties();
    private final RealtimeHub hub = new RealtimeHub(follows, subscriptions, registry, alarms, props, Frames.MAPPER,
            clock);

    private FakeHubSocket connect(String id, String did) {
        FakeHubSocket socket = new FakeHubSocket(id);
        hub.register(socket, new UserSession(did)).block();
        return socket;
    }

    private static RealtimeMessage message(String type, String field, String value) {
        ObjectNode payload = Frames.MAPPER.createObjectNode();
        if (field != null) {
            payload.put(field, value);
        }
        return new RealtimeMessage(type, payload);
    }

    @Test
    void registerGreetsAndArmsHeartbeat() {
        FakeHubSocket socket = connect("s1", "did:plc:a");

        assertThat(socket.sentOfType("connected")).hasSize(1);
        assertThat(socket.sent().get(0)).contains("\"timestamp\":" + clock.millis());
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, socket.attachment()))
                .contains(new ConnectionAttachment("did:plc:a", clock.instant()));
        assertThat(alarms.get(hub.alarmName()).block()).isEqualTo(clock.instant().plus(props.getHeartbeatInterval()));
        assertThat(hub.connectedCount()).isEqualTo(1);
    }

    @Test
    void newShareReachesFollowersOnly() {
        FakeHubSocket a = connect("a", "did:plc:a");
        FakeHubSocket b = connect("b", "did:plc:b");
        FakeHubSocket c = connect("c", "did:plc:c");
        follows.follow(FollowGraph.BLUESKY, "did:plc:a", "did:plc:x");
        follows.follow(FollowGraph.BLUESKY, "did:plc:c", "did:plc:x");
        follows.follow(FollowGraph.BLUESKY, "did:plc:b", "did:plc:y");

        StepVerifier.create(hub.broadcast(message("new_share", "authorDid", "did:plc:x")))
                .expectNext(2)
                .verifyComplete();

        assertThat(a.sentOfType("new_share")).hasSize(1);
        assertThat(b.sentOfType("new_share")).isEmpty();
        assertThat(c.sentOfType("new_share")).hasSize(1);
    }

    @Test
    void followMadeAfterConnectingIsHonored() {
        FakeHubSocket c = connect("c", "did:plc:c");
        hub.broadcast(message("new_share", "authorDid", "did:plc:x")).block();
        assertThat(c.sentOfType("new_share")).isEmpty();

        follows.follow(FollowGraph.INAPP, "did:plc:c", "did:plc:x");
        hub.broadcast(message("new_share", "authorDid", "did:plc:x")).block();

        assertThat(c.sentOfType("new_share")).hasSize(1);
    }

    @Test
    void newArticlesReachSubscribersOnly() {
        FakeHubSocket a = connect("a", "did:plc:a");
        FakeHubSocket b = connect("b", "did:plc:b");
        subscriptions.subscribe("did:plc:b", "https://feeds.example/rss");

        StepVerifier.create(hub.broadcast(message("new_articles", "feedUrl", "https://feeds.example/rss")))
                .expectNext(1)
                .verifyComplete();

        assertThat(a.sentOfType("new_articles")).isEmpty();
        assertThat(b.sentOfType("new_articles")).hasSize(1);
    }

    @Test
    void routedTypeWithoutKeyReachesNobody() {
        connect("a", "did:plc:a");

        StepVerifier.create(hub.broadcast(message("new_share", null, null))).expectNext(0).verifyComplete();
    }

    @Test
    void otherTypesReachEveryone() {
        FakeHubSocket a = connect("a", "did:plc:a");
        FakeHubSocket b = connect("b", "did:plc:b");

        StepVerifier.create(hub.broadcast(message("maintenance", "note", "soon"))).expectNext(2).verifyComplete();

        assertThat(a.sentOfType("maintenance")).hasSize(1);
        assertThat(b.sentOfType("maintenance")).hasSize(1);
    }

    @Test
    void failedSendDropsConnection() {
        FakeHubSocket a = connect("a", "did:plc:a");
        FakeHubSocket b = connect("b", "did:plc:b");
        a.failSends();

        StepVerifier.create(hub.broadcast(message("maintenance", null, null))).expectNext(1).verifyComplete();

        assertThat(hub.connectedCount()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(b.sentOfType("maintenance")).hasSize(1);
    }

    @Test
    void silentConnectionIsReclaimedAndResponsiveOneKept() {
        FakeHubSocket silent = connect("silent", "did:plc:a");
        FakeHubSocket alive = connect("alive", "did:plc:b");

        clock.advance(Duration.ofSeconds(60));
        hub.onMessage(alive, "{\"type\":\"pong\"}");
        clock.advance(Duration.ofSeconds(40));
        hub.onAlarm().block();

        assertThat(silent.closeCode()).isEqualTo(RealtimeHub.CLOSE_NORMAL);
        assertThat(silent.closeReason()).isEqualTo("Heartbeat timeout");
        assertThat(alive.closeCode()).isNull();
        assertThat(alive.sentOfType(NotificationType.HEARTBEAT.wire())).hasSize(1);
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, alive.attachment()).orElseThrow().lastHeartbeat())
                .isEqualTo(clock.instant().minusSeconds(40));
        assertThat(hub.connectedCount()).isEqualTo(1);
        assertThat(alarms.get(hub.alarmName()).block()).isEqualTo(clock.instant().plus(props.getHeartbeatInterval()));
    }

    @Test
    void framesOtherThanPongAreIgnored() {
        FakeHubSocket socket = connect("s", "did:plc:a");
        String before = socket.attachment();
        clock.advance(Duration.ofSeconds(10));

        hub.onMessage(socket, "{\"type\":\"subscribe\"}");
        hub.onMessage(socket, "not json");

        assertThat(socket.attachment()).isEqualTo(before);
    }

    @Test
    void heartbeatStopsWhenNobodyIsConnected() {
        FakeHubSocket socket = connect("s", "did:plc:a");
        hub.onClose(socket);

        hub.onAlarm().block();

        assertThat(alarms.get(hub.alarmName()).block()).isNull();
    }

    @Test
    void idleHubHibernatesAndRehydratesFromAttachments() {
        props.setHeartbeatTimeout(Duration.ofMinutes(30));
        FakeHubSocket a = connect("a", "did:plc:a");
        follows.follow(FollowGraph.BLUESKY, "did:plc:a", "did:plc:x");

        clock.advance(Duration.ofMinutes(6));
        hub.onAlarm().block();
        assertThat(hub.isAwake()).isFalse();
        assertThat(alarms.get(hub.alarmName()).block()).isNotNull();

        StepVerifier.create(hub.broadcast(message("new_share", "authorDid", "did:plc:x")))
                .expectNext(1)
                .verifyComplete();
        assertThat(hub.isAwake()).isTrue();
        assertThat(a.sentOfType("new_share")).hasSize(1);
    }

    @Test
    void unreadableAttachmentIsClosedOnWake() {
        FakeHubSocket good = connect("good", "did:plc:a");
        FakeHubSocket bad = connect("bad", "did:plc:b");
        hub.hibernate();
        bad.attach("{\"v\":2,\"did\":\"did:plc:b\"}");

        assertThat(hub.connectedCount()).isEqualTo(1);
        assertThat(bad.closeCode()).isEqualTo(RealtimeHub.CLOSE_INTERNAL_ERROR);
        assertThat(good.closeCode()).isNull();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void hubsSharingStateKeepTheirOwnHeartbeat() {
        RealtimeHub other = new RealtimeHub(follows, subscriptions, new SocketRegistry(), alarms, props,
                Frames.MAPPER, clock);
        assertThat(other.alarmName()).isNotEqualTo(hub.alarmName()).startsWith(RealtimeHub.ALARM + ":");

        FakeHubSocket mine = connect("mine", "did:plc:a");
        hub.onClose(mine);
        FakeHubSocket theirs = new FakeHubSocket("theirs");
        other.register(theirs, new UserSession("did:plc:b")).block();

        clock.advance(props.getHeartbeatInterval());
        hub.onAlarm().block();

        assertThat(alarms.get(hub.alarmName()).block()).isNull();
        assertThat(alarms.get(other.alarmName()).block()).isEqualTo(clock.instant());

        other.onAlarm().block();
        assertThat(theirs.sentOfType(NotificationType.HEARTBEAT.wire())).hasSize(1);
        assertThat(alarms.get(other.alarmName()).block())
                .isEqualTo(clock.instant().plus(props.getHeartbeatInterval()));
    }

    @Test
    void connectionArrivingAfterIdleCheckReArmsHeartbeat() {
        FakeHubSocket first = connect("first", "did:plc:a");
        hub.onClose(first);
        hub.onAlarm().block();
        assertThat(alarms.get(hub.alarmName()).block()).isNull();

        connect("second", "did:plc:b");

        assertThat(alarms.get(hub.alarmName()).block())
                .isEqualTo(clock.instant().plus(props.getHeartbeatInterval()));
    }

    @Test
    void registerRacingHibernateNeverLosesTheConnection() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                FakeHubSocket socket = new FakeHubSocket("s" + i);
                CountDownLatch go = new CountDownLatch(1);
                Future<?> sleeper = pool.submit(() -> {
                    go.await();
                    hub.hibernate();
                    return null;
                });
                Future<?> joiner = pool.submit(() -> {
                    go.await();
                    hub.register(socket, new UserSession("did:plc:" + socket.id())).block();
                    return null;
                });
                go.countDown();
                sleeper.get(5, TimeUnit.SECONDS);
                joiner.get(5, TimeUnit.SECONDS);

                assertThat(hub.connectedCount()).as("iteration %d", i).isEqualTo(registry.size());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
