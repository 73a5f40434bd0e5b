package com.skyreader.sync.core.store;

import com.skyreader.sync.core.model.FollowEdge;
import com.skyreader.sync.core.model.FollowGraph;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Follow edges of both graphs.
 */
public interface FollowStore {

    /**
     * Upserts on {@code (follower, following)}; a replayed create only refreshes the rkey.
     */
    Mono<Void> upsert(FollowGraph graph, FollowEdge edge);

    /**
     * Removes the edge the follower created under {@code rkey}. Absent rows are a no-op.
     *
     * @return true if a row was removed
     */
    Mono<Boolean> delete(FollowGraph graph, String followerDid, String rkey);

    /**
     * Current followers of {@code did} across both graphs, without duplicates. Always read from storage.
     */
    Flux<String> followersOf(String did);
}
