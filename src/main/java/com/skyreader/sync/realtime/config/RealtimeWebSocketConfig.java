package com.skyreader.sync.realtime.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;

import com.skyreader.sync.core.session.SessionResolver;
import com.skyreader.sync.realtime.ws.RealtimeWebSocketHandler;
import com.skyreader.sync.realtime.ws.SessionAuthenticatingWebSocketService;

/**
 * Exposes the realtime hub at {@code skyreader.realtime.path} with session authentication on the handshake.
 */
@Configuration
public class RealtimeWebSocketConfig implements WebFluxConfigurer {

	private final SessionResolver sessions;

	public RealtimeWebSocketConfig(SessionResolver sessions) {
		this.sessions = sessions;
	}

	@Bean
	public HandlerMapping realtimeHandlerMapping(RealtimeWebSocketHandler handler, RealtimeProperties props) {
		return new SimpleUrlHandlerMapping(Map.of(props.getPath(), handler), Ordered.HIGHEST_PRECEDENCE);
	}

	@Override
	public WebSocketService getWebSocketService() {
		return new SessionAuthenticatingWebSocketService(sessions);
	}
}
