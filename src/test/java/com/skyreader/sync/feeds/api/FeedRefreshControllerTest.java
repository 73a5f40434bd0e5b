package com.skyreader.sync.feeds.api;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.model.RefreshCandidate;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;
import com.skyreader.sync.feeds.fetch.FeedFetcher;
import com.skyreader.sync.feeds.parse.DocumentFeedParser;
import com.skyreader.sync.feeds.parse.FeedCacheCodec;
import com.skyreader.sync.feeds.refresh.FeedRefreshScheduler;
import com.skyreader.sync.feeds.refresh.FeedRefresher;
import com.skyreader.sync.support.Frames;
import com.skyreader.sync.support.InMemoryFeedStores;
import com.skyreader.sync.support.InMemoryStateStore;
import com.skyreader.sync.support.InMemorySubscriptionStore;
import com.skyreader.sync.support.MutableClock;
import com.skyreader.sync.support.RecordingNotifier;
import com.skyreader.sync.support.StubExchange;

class FeedRefreshControllerTest {

    private final MutableClock clock = MutableClock.at("2026-10-02T00:00:00Z");
    private final InMemoryStateStore state = new InMemoryStateStore();
    private final InMemorySubscriptionStore subscriptions = new InMemorySubscriptionStore();
    private final WebTestClient client;

    FeedRefreshControllerTest() {
        FeedRefreshProperties props = new FeedRefreshProperties();
        InMemoryFeedStores stores = new InMemoryFeedStores();
        FeedRefresher refresher = new FeedRefresher(
                new FeedFetcher(StubExchange.respond(HttpStatus.NOT_MODIFIED, "").builder(), props),
                new DocumentFeedParser(Frames.MAPPER, props), new FeedCacheCodec(Frames.MAPPER, props),
                stores.metadata, stores.cache, stores.items, new RecordingNotifier(), props, Frames.MAPPER, clock);
        FeedRefreshScheduler scheduler = new FeedRefreshScheduler(subscriptions, refresher, state,
                new Alarms(state, clock), props, Frames.MAPPER, clock);
        client = WebTestClient.bindToController(new FeedRefreshController(scheduler)).build();
    }

    @Test
    void triggerWithNothingSubscribed() {
        client.post().uri("/feeds/refresher/trigger")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("no_feeds")
                .jsonPath("$.feedCount").isEqualTo(0);
    }

    @Test
    void triggerThenStatusShowsCycle() {
        subscriptions.addCandidate(RefreshCandidate.of("https://feeds.example/a", 2));
        subscriptions.addCandidate(RefreshCandidate.of("https://feeds.example/b", 1));

        client.post().uri("/feeds/refresher/trigger")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("started")
                .jsonPath("$.feedCount").isEqualTo(2)
                .jsonPath("$.progress").doesNotExist();

        client.post().uri("/feeds/refresher/trigger")
                .exchange()
                .expectBody()
                .jsonPath("$.status").isEqualTo("in_progress")
                .jsonPath("$.progress").isEqualTo("0/2");

        client.get().uri("/feeds/refresher/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cycleState.totalFeeds").isEqualTo(2)
                .jsonPath("$.cycleState.currentIndex").isEqualTo(0)
                .jsonPath("$.running").isEqualTo(true);
    }
}
