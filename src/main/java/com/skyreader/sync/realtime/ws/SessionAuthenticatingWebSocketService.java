package com.skyreader.sync.realtime.ws;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.server.ServerWebExchange;

import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.core.session.SessionResolver;

import reactor.core.publisher.Mono;

/**
 * Handshake that authenticates before upgrading.
 *
 * <p>The token is taken from the first offered subprotocol of the form {@code bearer-<token>}, falling back to the
 * {@code token} query parameter. Unauthenticated requests get a plain 401 and are never upgraded. When the client
 * offered subprotocols, the first one is echoed back as the accepted protocol.</p>
 */
public class SessionAuthenticatingWebSocketService extends HandshakeWebSocketService {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticatingWebSocketService.class);

    static final String BEARER_PREFIX = "bearer-";
    static final String SEC_WEBSOCKET_PROTOCOL = "Sec-WebSocket-Protocol";

    private final SessionResolver sessions;

    public SessionAuthenticatingWebSocketService(SessionResolver sessions) {
        this.sessions = sessions;
    }

    @Override
    public Mono<Void> handleRequest(ServerWebExchange exchange, WebSocketHandler handler) {
        HttpHeaders headers = exchange.getRequest().getHeaders();
        if (!"websocket".equalsIgnoreCase(headers.getUpgrade())) {
            return reject(exchange, HttpStatus.UPGRADE_REQUIRED, "Expected WebSocket upgrade");
        }

        List<String> protocols = offeredProtocols(headers);
        Optional<String> token = token(protocols, exchange.getRequest().getQueryParams().getFirst("token"));
        if (token.isEmpty()) {
            return reject(exchange, HttpStatus.UNAUTHORIZED, "Missing session token");
        }

        return sessions.resolve(token.get())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(user -> user.isEmpty()
                        ? reject(exchange, HttpStatus.UNAUTHORIZED, "Invalid session")
                        : super.handleRequest(exchange, new AuthenticatedHandler(handler, user.get(),
                                protocols.isEmpty() ? List.of() : List.of(protocols.get(0)))));
    }

    static List<String> offeredProtocols(HttpHeaders headers) {
        return headers.getOrEmpty(SEC_WEBSOCKET_PROTOCOL).stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    static Optional<String> token(List<String> protocols, String queryToken) {
        for (String protocol : protocols) {
            if (protocol.startsWith(BEARER_PREFIX)) {
                String value = protocol.substring(BEARER_PREFIX.length());
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.ofNullable(queryToken).filter(t -> !t.isBlank());
    }

    private static Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String reason) {
        log.debug("Realtime handshake rejected status={} reason={}", status.value(), reason);
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
        return response.writeWith(Mono.just(response.bufferFactory()
                .wrap(reason.getBytes(StandardCharsets.UTF_8))));
    }

    /**
     * Per-handshake wrapper that carries the resolved identity into the session and narrows the accepted
     * subprotocol to the one being echoed.
     */
    private record AuthenticatedHandler(WebSocketHandler delegate, UserSession user, List<String> subProtocols)
            implements WebSocketHandler {

        @Override
        public List<String> getSubProtocols() {
            return subProtocols;
        }

        @Override
        public Mono<Void> handle(WebSocketSession session) {
            Map<String, Object> attributes = session.getAttributes();
            attributes.put(RealtimeWebSocketHandler.USER_ATTRIBUTE, user);
            return delegate.handle(session);
        }
    }
}
