package com.skyreader.sync.core.model;

import java.util.Optional;

/**
 * Record collections this service mirrors into its local cache.
 *
 * <p>The NSID is the exact string used both in {@code wantedCollections} subscription parameters and in the
 * {@code commit.collection} field of inbound frames.</p>
 */
public enum WatchedCollection {

    /** Article shared by a user. Cached in {@code shares}. */
    SHARE("app.skyreader.social.share"),

    /** Bluesky social-graph follow. Cached in {@code follows_cache}. */
    GRAPH_FOLLOW("app.bsky.graph.follow"),

    /** Reader-only follow. Cached in {@code inapp_follows}. */
    INAPP_FOLLOW("app.skyreader.social.follow");

    private final String nsid;

    WatchedCollection(String nsid) {
        this.nsid = nsid;
    }

    public String nsid() {
        return nsid;
    }

    public static Optional<WatchedCollection> fromNsid(String nsid) {
        if (nsid == null) {
            return Optional.empty();
        }
        for (WatchedCollection c : values()) {
            if (c.nsid.equals(nsid)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
