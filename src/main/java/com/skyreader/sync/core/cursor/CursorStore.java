package com.skyreader.sync.core.cursor;

import reactor.core.publisher.Mono;

/**
 * Durable last-seen position per logical stream.
 *
 * <p>Positions are upstream stream times in microseconds. Cursors are independent of each other and are
 * overwritten, never deleted.</p>
 */
public interface CursorStore {

    /**
     * @return the stored position, or an empty Mono when the stream has never persisted one
     */
    Mono<Long> get(String streamId);

    Mono<Void> put(String streamId, long position);
}
