package com.skyreader.sync.core.store;

import com.skyreader.sync.core.model.RecordUri;
import com.skyreader.sync.core.model.Share;

import reactor.core.publisher.Mono;

/**
 * Cached shares, one row per record URI.
 */
public interface ShareStore {

    /**
     * Inserts the share or replaces every field of the existing row with the same record URI.
     */
    Mono<Void> upsert(Share share);

    /**
     * @return true if a row was removed; false (not an error) when none existed
     */
    Mono<Boolean> delete(RecordUri recordUri);
}
