package com.skyreader.sync.poller;

import com.skyreader.sync.core.model.WatchedCollection;

/**
 * The independently cursored subscriptions drained on every poll cycle, in cycle order.
 */
public enum LogicalStream {

    SHARES(WatchedCollection.SHARE, "cursor_shares", false),

    /** Only the follows of active local users are of interest, so this stream is DID-filtered. */
    FOLLOWS(WatchedCollection.GRAPH_FOLLOW, "cursor_follows", true),

    INAPP_FOLLOWS(WatchedCollection.INAPP_FOLLOW, "cursor_inapp_follows", false);

    private final WatchedCollection collection;
    private final String cursorKey;
    private final boolean activeUsersOnly;

    LogicalStream(WatchedCollection collection, String cursorKey, boolean activeUsersOnly) {
        this.collection = collection;
        this.cursorKey = cursorKey;
        this.activeUsersOnly = activeUsersOnly;
    }

    public WatchedCollection collection() {
        return collection;
    }

    public String cursorKey() {
        return cursorKey;
    }

    public boolean activeUsersOnly() {
        return activeUsersOnly;
    }
}
