package com.skyreader.sync.ingest;

import java.time.Clock;

import org.springframework.stereotype.Component;

import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.model.WatchedCollection;
import com.skyreader.sync.core.store.FollowStore;
import com.skyreader.sync.core.store.UserStore;

/**
 * {@code app.skyreader.social.follow} into {@code inapp_follows}.
 */
@Component
public class InappFollowCommitProcessor extends FollowCommitProcessor {

    public InappFollowCommitProcessor(FollowStore follows, UserStore users, ProfileResolver profiles, Clock clock) {
        super(FollowGraph.INAPP, follows, users, profiles, clock);
    }

    @Override
    public WatchedCollection collection() {
        return WatchedCollection.INAPP_FOLLOW;
    }
}
