package com.skyreader.sync.core.store;

import java.time.Instant;

import com.skyreader.sync.core.model.Profile;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Identity rows in {@code users}.
 */
public interface UserStore {

    /**
     * Creates a placeholder row (handle = did) when the DID is unknown. Existing rows are untouched.
     */
    Mono<Void> ensureExists(String did, Instant now);

    /**
     * Upserts profile fields. Null fields never overwrite known values, and a handle equal to the DID never
     * replaces a resolved handle.
     */
    Mono<Void> upsertProfile(Profile profile, Instant now);

    /**
     * DIDs of users with a PDS that were active at or after {@code since}, most recent first.
     */
    Flux<String> activeDids(Instant since, int limit);

    /**
     * Any known DIDs, most recently active first. Used to seed the watched identity set.
     */
    Flux<String> knownDids(int limit);
}
