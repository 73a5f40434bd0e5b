package com.skyreader.sync.core.model;

/**
 * The two follow tables the service maintains.
 */
public enum FollowGraph {
    BLUESKY("follows_cache"),
    INAPP("inapp_follows");

    private final String table;

    FollowGraph(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
