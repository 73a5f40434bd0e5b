package com.skyreader.sync.consumer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.store.UserStore;
import com.skyreader.sync.core.store.WatchedDidStore;
import com.skyreader.sync.jetstream.config.JetstreamProperties;
import com.skyreader.sync.jetstream.subscribe.SubscribeUri;

import reactor.core.publisher.Mono;

/**
 * Identities the live subscription is filtered to, bounded by {@code maxWatchedDids}.
 *
 * <p>Backed by {@code watched_dids}. On a cold start (nothing stored yet) the set is seeded from the known
 * users and the seed is persisted.</p>
 */
@Component
@ConditionalOnProperty(prefix = "skyreader.jetstream.live", name = "enabled", havingValue = "true")
public class WatchedIdentitySet {

    private static final Logger log = LoggerFactory.getLogger(WatchedIdentitySet.class);

    public enum AddResult {
        ADDED,
        ALREADY_WATCHED,
        FULL
    }

    private final WatchedDidStore store;
    private final UserStore users;
    private final int capacity;

    private final Set<String> dids = new LinkedHashSet<>();

    public WatchedIdentitySet(WatchedDidStore store, UserStore users, JetstreamProperties props) {
        this.store = store;
        this.users = users;
        this.capacity = Math.min(props.getLive().getMaxWatchedDids(), SubscribeUri.MAX_WANTED_DIDS);
    }

    /**
     * Loads the persisted set, seeding it from {@code users} when empty.
     *
     * @return number of watched identities
     */
    public Mono<Integer> load() {
        return store.findAll(capacity).collectList().flatMap(stored -> {
            if (!stored.isEmpty()) {
                replace(stored);
                log.info("Loaded {} watched identities", stored.size());
                return Mono.just(stored.size());
            }
            return users.knownDids(capacity)
                    .filter(SubscribeUri::isDid)
                    .collectList()
                    .flatMap(seed -> store.addAll(seed).then(Mono.fromCallable(() -> {
                        replace(seed);
                        log.info("Seeded {} watched identities from users", seed.size());
                        return seed.size();
                    })));
        });
    }

    public Mono<AddResult> add(String did) {
        return Mono.defer(() -> {
            synchronized (dids) {
                if (dids.contains(did)) {
                    return Mono.just(AddResult.ALREADY_WATCHED);
                }
                if (dids.size() >= capacity) {
                    log.warn("Watched identity set full capacity={} rejected={}", capacity, did);
                    return Mono.just(AddResult.FULL);
                }
            }
            return store.add(did).then(Mono.fromCallable(() -> {
                synchronized (dids) {
                    return dids.add(did) ? AddResult.ADDED : AddResult.ALREADY_WATCHED;
                }
            }));
        });
    }

    public List<String> snapshot() {
        synchronized (dids) {
            return new ArrayList<>(dids);
        }
    }

    public int size() {
        synchronized (dids) {
            return dids.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void replace(List<String> values) {
        synchronized (dids) {
            dids.clear();
            dids.addAll(values);
        }
    }
}
