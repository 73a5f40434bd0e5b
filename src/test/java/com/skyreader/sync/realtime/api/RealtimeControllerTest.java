package com.skyreader.sync.realtime.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.realtime.config.RealtimeProperties;
import com.skyreader.sync.realtime.hub.RealtimeHub;
import com.skyreader.sync.realtime.hub.SocketRegistry;
import com.skyreader.sync.support.FakeHubSocket;
import com.skyreader.sync.support.Frames;
import com.skyreader.sync.support.InMemoryFollowStore;
import com.skyreader.sync.support.InMemoryStateStore;
import com.skyreader.sync.support.InMemorySubscriptionStore;
import com.skyreader.sync.support.MutableClock;

class RealtimeControllerTest {

    private final MutableClock clock = MutableClock.at("2026-10-01T12:00:00Z");
    private final InMemoryFollowStore follows = new InMemoryFollowStore();
    private final RealtimeHub hub = new RealtimeHub(follows, new InMemorySubscriptionStore(), new SocketRegistry(),
            new Alarms(new InMemoryStateStore(), clock), new RealtimeProperties(), Frames.MAPPER, clock);
    private final WebTestClient client = WebTestClient.bindToController(new RealtimeController(hub)).build();

    @Test
    void broadcastReportsDeliveries() {
        FakeHubSocket follower = new FakeHubSocket("f");
        hub.register(follower, new UserSession("did:plc:f")).block();
        hub.register(new FakeHubSocket("o"), new UserSession("did:plc:o")).block();
        follows.follow(FollowGraph.BLUESKY, "did:plc:f", "did:plc:author");

        client.post().uri("/realtime/broadcast")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"new_share\",\"payload\":{\"authorDid\":\"did:plc:author\",\"itemUrl\":\"https://x\"}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.delivered").isEqualTo(1);

        assertThat(follower.sentOfType("new_share")).singleElement()
                .satisfies(frame -> assertThat(frame).contains("\"itemUrl\":\"https://x\""));
    }

    @Test
    void broadcastWithoutTypeIsRejected() {
        client.post().uri("/realtime/broadcast")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"payload\":{}}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void statusCountsConnections() {
        hub.register(new FakeHubSocket("a"), new UserSession("did:plc:a")).block();

        client.get().uri("/realtime/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.connectedClients").isEqualTo(1);
    }
}
