package com.skyreader.sync.ingest;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyreader.sync.core.model.CommitOperation;
import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.NotificationType;
import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.model.RecordUri;
import com.skyreader.sync.core.model.Share;
import com.skyreader.sync.core.model.WatchedCollection;
import com.skyreader.sync.core.notify.RealtimeNotifier;
import com.skyreader.sync.core.store.ShareStore;
import com.skyreader.sync.core.store.UserStore;

import reactor.core.publisher.Mono;

/**
 * Mirrors share records into {@code shares}.
 *
 * <ul>
 *   <li>create / update: resolve article content (best effort), upsert by record URI, make sure the author
 *       has a {@code users} row.</li>
 *   <li>create only: announce {@code new_share} to the author's followers.</li>
 *   <li>delete: remove by record URI.</li>
 * </ul>
 */
@Component
public class ShareCommitProcessor implements CommitProcessor {

    private static final Logger log = LoggerFactory.getLogger(ShareCommitProcessor.class);

    private final ShareStore shares;
    private final UserStore users;
    private final ArticleContentResolver content;
    private final RealtimeNotifier notifier;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ShareCommitProcessor(ShareStore shares, UserStore users, ArticleContentResolver content,
            RealtimeNotifier notifier, ObjectMapper mapper, Clock clock) {
        this.shares = shares;
        this.users = users;
        this.content = content;
        this.notifier = notifier;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public WatchedCollection collection() {
        return WatchedCollection.SHARE;
    }

    @Override
    public Mono<CommitOutcome> process(JetstreamEvent event) {
        JetstreamEvent.Commit commit = event.commit();
        RecordUri uri = event.recordUri();

        if (commit.operation() == CommitOperation.DELETE) {
            return shares.delete(uri).doOnNext(removed -> {
                if (removed) {
                    log.info("Share deleted uri={}", uri);
                }
            }).thenReturn(CommitOutcome.DELETED);
        }
        if (!commit.operation().isUpsert() || !commit.hasRecord()) {
            return Mono.just(CommitOutcome.IGNORED);
        }

        Instant now = clock.instant();
        Share parsed;
        try {
            parsed = ShareRecords.toShare(uri, commit.cid(), commit.record(), now);
        } catch (InvalidRecordException e) {
            return Mono.error(e);
        }

        return enrich(parsed)
                .flatMap(share -> shares.upsert(share)
                        .then(users.ensureExists(share.authorDid(), now))
                        .then(Mono.defer(() -> commit.operation() == CommitOperation.CREATE
                                ? announce(share)
                                : Mono.<Void>empty()))
                        .doOnSuccess(v -> log.info("Share indexed uri={} op={} content={}", uri,
                                commit.operation(), share.content() != null))
                        .thenReturn(CommitOutcome.UPSERTED));
    }

    private Mono<Share> enrich(Share share) {
        if (share.feedUrl() == null || share.itemGuid() == null) {
            return Mono.just(share);
        }
        return content.resolve(share.feedUrl(), share.itemGuid(), share.itemUrl())
                .map(share::withContent)
                .defaultIfEmpty(share);
    }

    private Mono<Void> announce(Share share) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("authorDid", share.authorDid());
        payload.put("recordUri", share.recordUri().toString());
        payload.put("feedUrl", share.feedUrl());
        payload.put("itemUrl", share.itemUrl());
        payload.put("itemTitle", share.itemTitle());
        payload.put("itemDescription", share.itemDescription());
        payload.put("itemImage", share.itemImage());
        payload.put("itemGuid", share.itemGuid());
        payload.put("itemPublishedAt", share.itemPublishedAt() == null ? null : share.itemPublishedAt().toString());
        payload.put("note", share.note());
        payload.put("content", share.content());
        payload.put("createdAt", share.createdAt().toString());

        // detached: hub latency or failure must not hold up the stream
        notifier.notify(RealtimeMessage.of(NotificationType.NEW_SHARE, payload))
                .subscribe(v -> { }, err -> log.warn("new_share notify failed uri={} err={}",
                        share.recordUri(), err.toString()));
        return Mono.empty();
    }
}
