package com.skyreader.sync.consumer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.jetstream.config.JetstreamProperties;
import com.skyreader.sync.jetstream.subscribe.SubscribeUri;
import com.skyreader.sync.support.InMemoryUserStore;
import com.skyreader.sync.support.InMemoryWatchedDidStore;

import reactor.test.StepVerifier;

class WatchedIdentitySetTest {

    private final InMemoryWatchedDidStore store = new InMemoryWatchedDidStore();
    private final InMemoryUserStore users = new InMemoryUserStore();
    private final JetstreamProperties props = new JetstreamProperties();

    @Test
    void coldStartSeedsFromUsersAndPersists() {
        users.markActive("did:plc:a", "did:plc:b");
        WatchedIdentitySet set = new WatchedIdentitySet(store, users, props);

        StepVerifier.create(set.load()).expectNext(2).verifyComplete();

        assertThat(set.snapshot()).containsExactlyInAnyOrder("did:plc:a", "did:plc:b");
        assertThat(store.stored()).containsExactlyInAnyOrder("did:plc:a", "did:plc:b");
    }

    @Test
    void storedSetWinsOverUsers() {
        store.add("did:plc:stored").block();
        users.markActive("did:plc:a");
        WatchedIdentitySet set = new WatchedIdentitySet(store, users, props);

        set.load().block();

        assertThat(set.snapshot()).containsExactly("did:plc:stored");
    }

    @Test
    void addReportsDuplicatesAndCapacity() {
        props.getLive().setMaxWatchedDids(2);
        WatchedIdentitySet set = new WatchedIdentitySet(store, users, props);

        StepVerifier.create(set.add("did:plc:a")).expectNext(WatchedIdentitySet.AddResult.ADDED).verifyComplete();
        StepVerifier.create(set.add("did:plc:a"))
                .expectNext(WatchedIdentitySet.AddResult.ALREADY_WATCHED)
                .verifyComplete();
        set.add("did:plc:b").block();
        StepVerifier.create(set.add("did:plc:c")).expectNext(WatchedIdentitySet.AddResult.FULL).verifyComplete();

        assertThat(set.size()).isEqualTo(2);
        assertThat(store.stored()).containsExactly("did:plc:a", "did:plc:b");
    }

    @Test
    void capacityNeverExceedsSubscriptionFilterLimit() {
        props.getLive().setMaxWatchedDids(1_000_000);

        assertThat(new WatchedIdentitySet(store, users, props).capacity())
                .isEqualTo(SubscribeUri.MAX_WANTED_DIDS);
    }
}
