package com.skyreader.sync.realtime.ws;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.realtime.hub.RealtimeHub;

import reactor.core.publisher.Mono;

/**
 * Bridges an accepted WebSocket session to the {@link RealtimeHub}. The session must carry the
 * {@link UserSession} resolved during the handshake.
 */
@Component
public class RealtimeWebSocketHandler implements WebSocketHandler {

    public static final String USER_ATTRIBUTE = "skyreader.realtime.user";

    private final RealtimeHub hub;

    public RealtimeWebSocketHandler(RealtimeHub hub) {
        this.hub = hub;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        if (!(session.getAttributes().get(USER_ATTRIBUTE) instanceof UserSession user)) {
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        WebSocketSessionSocket socket = new WebSocketSessionSocket(session);

        Mono<Void> input = session.receive()
                .filter(m -> m.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(m -> hub.onMessage(socket, m.getPayloadAsText()))
                .doFinally(signal -> socket.complete())
                .then();
        Mono<Void> output = session.send(socket.outbound());

        return hub.register(socket, user)
                .then(Mono.zip(input, output).then())
                .doFinally(signal -> hub.onClose(socket));
    }
}
