package com.skyreader.sync.ingest;

import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.WatchedCollection;

import reactor.core.publisher.Mono;

/**
 * Applies commits of one collection to the local cache.
 *
 * <p>Implementations must be idempotent: replaying a commit (cursor overlap) yields the same state, and a
 * delete of an absent row succeeds. Enrichment failures degrade to null fields; only a failure of the core
 * mutation, or a record that cannot be interpreted, errors the returned Mono.</p>
 */
public interface CommitProcessor {

    WatchedCollection collection();

    Mono<CommitOutcome> process(JetstreamEvent event);
}
