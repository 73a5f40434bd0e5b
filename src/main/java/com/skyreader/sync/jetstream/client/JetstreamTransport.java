package com.skyreader.sync.jetstream.client;

import java.net.URI;

import reactor.core.publisher.Flux;

/**
 * Raw text frames of one firehose connection.
 *
 * <p>Subscribing opens the connection; cancelling closes it. The Flux completes when the server closes and
 * errors when the connection cannot be established or breaks.</p>
 */
public interface JetstreamTransport {

    Flux<String> frames(URI uri);
}
