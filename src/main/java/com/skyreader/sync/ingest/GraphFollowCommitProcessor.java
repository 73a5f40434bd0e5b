package com.skyreader.sync.ingest;

import java.time.Clock;

import org.springframework.stereotype.Component;

import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.model.WatchedCollection;
import com.skyreader.sync.core.store.FollowStore;
import com.skyreader.sync.core.store.UserStore;

/**
 * {@code app.bsky.graph.follow} into {@code follows_cache}.
 */
@Component
public class GraphFollowCommitProcessor extends FollowCommitProcessor {

    public GraphFollowCommitProcessor(FollowStore follows, UserStore users, ProfileResolver profiles, Clock clock) {
        super(FollowGraph.BLUESKY, follows, users, profiles, clock);
    }

    @Override
    public WatchedCollection collection() {
        return WatchedCollection.GRAPH_FOLLOW;
    }
}
