package com.skyreader.sync.jetstream.client;

import java.util.concurrent.atomic.AtomicLong;

import reactor.core.publisher.Flux;

import com.skyreader.sync.core.model.JetstreamEvent;

/**
 * One opened (lazily, on subscribe) firehose stream plus the resume token it has reached.
 *
 * <p>The token starts at the request's resume token (or the live-tail baseline) and only moves forward: it
 * is the maximum stream time seen on any frame, whether or not the frame was of interest. Overlap replay of
 * older frames therefore never moves it backwards.</p>
 */
public final class StreamSession {

    private final Flux<JetstreamEvent> events;
    private final long startToken;
    private final AtomicLong latest;

    StreamSession(Flux<JetstreamEvent> events, long startToken, AtomicLong latest) {
        this.events = events;
        this.startToken = startToken;
        this.latest = latest;
    }

    /**
     * Decoded frames. Completes on idle, hard timeout, server close or transport error; never errors.
     */
    public Flux<JetstreamEvent> events() {
        return events;
    }

    public long startToken() {
        return startToken;
    }

    /**
     * Best-known position to resume from. Safe to read at any time, including after the stream ended.
     */
    public long resumeToken() {
        return latest.get();
    }
}
