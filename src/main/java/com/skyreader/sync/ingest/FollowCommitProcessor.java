package com.skyreader.sync.ingest;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.skyreader.sync.core.model.CommitOperation;
import com.skyreader.sync.core.model.FollowEdge;
import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.RecordUri;
import com.skyreader.sync.core.store.FollowStore;
import com.skyreader.sync.core.store.UserStore;

import reactor.core.publisher.Mono;

/**
 * Shared logic for follow records ({@code {"subject": "<did>", "createdAt": ...}}).
 *
 * <ul>
 *   <li>create / update: upsert the edge on {@code (follower, subject)}, then refresh the follower's profile.
 *       A failed profile lookup leaves the edge in place.</li>
 *   <li>delete: remove by {@code (follower, rkey)}; deletes only carry the rkey.</li>
 * </ul>
 */
abstract class FollowCommitProcessor implements CommitProcessor {

    private static final Logger log = LoggerFactory.getLogger(FollowCommitProcessor.class);

    private final FollowGraph graph;
    private final FollowStore follows;
    private final UserStore users;
    private final ProfileResolver profiles;
    private final Clock clock;

    protected FollowCommitProcessor(FollowGraph graph, FollowStore follows, UserStore users,
            ProfileResolver profiles, Clock clock) {
        this.graph = graph;
        this.follows = follows;
        this.users = users;
        this.profiles = profiles;
        this.clock = clock;
    }

    @Override
    public Mono<CommitOutcome> process(JetstreamEvent event) {
        JetstreamEvent.Commit commit = event.commit();
        String follower = event.did();

        if (commit.operation() == CommitOperation.DELETE) {
            return follows.delete(graph, follower, commit.rkey()).thenReturn(CommitOutcome.DELETED);
        }
        if (!commit.operation().isUpsert() || !commit.hasRecord()) {
            return Mono.just(CommitOutcome.IGNORED);
        }

        String subject = ShareRecords.text(commit.record(), "subject");
        if (subject == null || !subject.startsWith("did:")) {
            return Mono.error(new InvalidRecordException(
                    graph + " follow " + event.recordUri() + " has no valid subject"));
        }

        RecordUri uri = event.recordUri();
        FollowEdge edge = new FollowEdge(follower, subject, commit.rkey(), uri);

        return follows.upsert(graph, edge)
                .then(refreshProfile(follower))
                .doOnSuccess(v -> log.debug("Follow cached graph={} follower={} following={}", graph, follower,
                        subject))
                .thenReturn(CommitOutcome.UPSERTED);
    }

    private Mono<Void> refreshProfile(String did) {
        return profiles.resolve(did)
                .flatMap(profile -> users.upsertProfile(profile, clock.instant()))
                .onErrorResume(err -> {
                    log.warn("Profile upsert failed did={} err={}", did, err.toString());
                    return Mono.empty();
                });
    }
}
