package com.skyreader.sync.realtime.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.skyreader.sync.realtime.hub.HubSocket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * {@link HubSocket} over a server-side {@link WebSocketSession}. Frames go through a unicast sink that the
 * session's send pipeline drains; the attachment lives in the session attributes.
 */
final class WebSocketSessionSocket implements HubSocket {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionSocket.class);

    static final String ATTACHMENT_ATTRIBUTE = "skyreader.realtime.attachment";

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

    WebSocketSessionSocket(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    // broadcasts and heartbeats may emit from different threads
    @Override
    public synchronized boolean send(String text) {
        return outbound.tryEmitNext(text).isSuccess();
    }

    @Override
    public void close(int code, String reason) {
        complete();
        session.close(new CloseStatus(code, reason)).subscribe(
                v -> { },
                err -> log.debug("Close failed id={} err={}", id(), err.toString())
        );
    }

    @Override
    public String attachment() {
        Object value = session.getAttributes().get(ATTACHMENT_ATTRIBUTE);
        return value instanceof String s ? s : null;
    }

    @Override
    public void attach(String attachment) {
        session.getAttributes().put(ATTACHMENT_ATTRIBUTE, attachment);
    }

    synchronized void complete() {
        outbound.tryEmitComplete();
    }

    Flux<WebSocketMessage> outbound() {
        return outbound.asFlux().map(session::textMessage);
    }
}
