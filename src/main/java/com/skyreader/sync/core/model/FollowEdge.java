package com.skyreader.sync.core.model;

/**
 * Directed follow relationship as cached locally. The natural key is {@code (followerDid, followingDid)};
 * deletes arrive keyed by {@code (followerDid, rkey)}.
 */
public record FollowEdge(String followerDid, String followingDid, String rkey, RecordUri recordUri) {
}
