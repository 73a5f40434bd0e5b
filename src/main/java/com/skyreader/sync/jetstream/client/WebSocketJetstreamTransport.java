package com.skyreader.sync.jetstream.client;

import java.net.URI;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

/**
 * {@link JetstreamTransport} over the Reactor Netty WebSocket client.
 */
@Component
public class WebSocketJetstreamTransport implements JetstreamTransport {

    /** Records with long descriptions exceed Netty's 64 KiB default. */
    private static final int MAX_FRAME_BYTES = 1024 * 1024;

    private final WebSocketClient client;

    public WebSocketJetstreamTransport() {
        this(new ReactorNettyWebSocketClient(HttpClient.create(),
                () -> WebsocketClientSpec.builder().maxFramePayloadLength(MAX_FRAME_BYTES)));
    }

    WebSocketJetstreamTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public Flux<String> frames(URI uri) {
        return Flux.create(sink -> {
            Disposable connection = client.execute(uri, session -> session.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .doOnNext(sink::next)
                            .then())
                    .subscribe(v -> { }, sink::error, sink::complete);
            sink.onDispose(connection);
        });
    }
}
