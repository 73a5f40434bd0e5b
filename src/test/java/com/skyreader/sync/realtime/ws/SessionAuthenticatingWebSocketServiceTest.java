package com.skyreader.sync.realtime.ws;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.reactive.socket.WebSocketHandler;

import com.skyreader.sync.core.model.UserSession;

import reactor.core.publisher.Mono;

class SessionAuthenticatingWebSocketServiceTest {

    private final SessionAuthenticatingWebSocketService service = new SessionAuthenticatingWebSocketService(
            token -> "good".equals(token) ? Mono.just(new UserSession("did:plc:a")) : Mono.empty());

    private final WebSocketHandler neverCalled = session -> Mono.error(new AssertionError("upgraded"));

    @Test
    void plainHttpRequestNeedsUpgrade() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/realtime"));

        service.handleRequest(exchange, neverCalled).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UPGRADE_REQUIRED);
        assertThat(exchange.getResponse().getBodyAsString().block()).isEqualTo("Expected WebSocket upgrade");
    }

    @Test
    void upgradeWithoutTokenIsUnauthorized() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/realtime")
                .header(HttpHeaders.UPGRADE, "websocket"));

        service.handleRequest(exchange, neverCalled).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block()).isEqualTo("Missing session token");
    }

    @Test
    void unknownSessionIsUnauthorized() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/realtime")
                .header(HttpHeaders.UPGRADE, "websocket")
                .header(SessionAuthenticatingWebSocketService.SEC_WEBSOCKET_PROTOCOL, "bearer-stale"));

        service.handleRequest(exchange, neverCalled).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block()).isEqualTo("Invalid session");
    }

    @Test
    void offeredProtocolsAreSplitAndTrimmed() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(SessionAuthenticatingWebSocketService.SEC_WEBSOCKET_PROTOCOL, "bearer-abc, skyreader.v1");
        headers.add(SessionAuthenticatingWebSocketService.SEC_WEBSOCKET_PROTOCOL, " ,json");

        assertThat(SessionAuthenticatingWebSocketService.offeredProtocols(headers))
                .containsExactly("bearer-abc", "skyreader.v1", "json");
    }

    @Test
    void protocolHeaderIsMatchedWhateverItsCase() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("sec-websocket-protocol", "bearer-abc");

        assertThat(SessionAuthenticatingWebSocketService.offeredProtocols(headers)).containsExactly("bearer-abc");
    }

    @Test
    void bearerProtocolWinsOverQueryParameter() {
        assertThat(SessionAuthenticatingWebSocketService.token(List.of("skyreader.v1", "bearer-abc"), "q"))
                .contains("abc");
        assertThat(SessionAuthenticatingWebSocketService.token(List.of("bearer-"), "q")).contains("q");
        assertThat(SessionAuthenticatingWebSocketService.token(List.of(), " ")).isEqualTo(Optional.empty());
    }
}
