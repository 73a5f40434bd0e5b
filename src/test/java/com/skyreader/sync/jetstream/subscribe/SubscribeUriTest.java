package com.skyreader.sync.jetstream.subscribe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.core.model.WatchedCollection;

class SubscribeUriTest {

    private static final String ENDPOINT = "wss://jetstream.example/subscribe";

    @Test
    void rendersCollectionsDidsAndCursor() {
        SubscribeUri uri = SubscribeUri.builder()
                .endpoint(ENDPOINT)
                .collection(WatchedCollection.SHARE)
                .collection(WatchedCollection.GRAPH_FOLLOW)
                .wantedDids(List.of("did:plc:alice", "did:plc:alice", "not-a-did", "", "did:web:example.com"))
                .cursor(1234L)
                .build();

        assertThat(uri.toUri().toString()).isEqualTo(ENDPOINT
                + "?wantedCollections=app.skyreader.social.share"
                + "&wantedCollections=app.bsky.graph.follow"
                + "&wantedDids=did:plc:alice"
                + "&wantedDids=did:web:example.com"
                + "&cursor=1234");
        assertThat(uri.wantedDids()).containsExactly("did:plc:alice", "did:web:example.com");
    }

    @Test
    void omitsCursorWhenAbsent() {
        SubscribeUri uri = SubscribeUri.builder().endpoint(ENDPOINT).collection(WatchedCollection.SHARE).build();

        assertThat(uri.toUri().getQuery()).doesNotContain("cursor").doesNotContain("wantedDids");
    }

    @Test
    void requiresACollectionAndAWebSocketEndpoint() {
        assertThatThrownBy(() -> SubscribeUri.builder().endpoint(ENDPOINT).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubscribeUri.builder().endpoint("https://x").collection(WatchedCollection.SHARE)
                .build()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enforcesDidCap() {
        List<String> dids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            dids.add("did:plc:user" + i);
        }

        assertThatThrownBy(() -> SubscribeUri.builder().endpoint(ENDPOINT).collection(WatchedCollection.SHARE)
                .maxWantedDids(3).wantedDids(dids).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit is 3");
    }

    @Test
    void recognizesDids() {
        assertThat(SubscribeUri.isDid("did:plc:abc123")).isTrue();
        assertThat(SubscribeUri.isDid("did:web:example.com")).isTrue();
        assertThat(SubscribeUri.isDid("alice.bsky.social")).isFalse();
        assertThat(SubscribeUri.isDid(null)).isFalse();
    }
}
