package com.skyreader.sync.core.store;

import java.util.Collection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for the live consumer's watched identity set.
 */
public interface WatchedDidStore {

    Flux<String> findAll(int limit);

    /**
     * @return true if the DID was not stored before
     */
    Mono<Boolean> add(String did);

    Mono<Void> addAll(Collection<String> dids);
}
