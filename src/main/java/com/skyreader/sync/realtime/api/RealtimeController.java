package com.skyreader.sync.realtime.api;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.realtime.hub.RealtimeHub;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import reactor.core.publisher.Mono;

/**
 * Internal hub surface: broadcast entry point for remote notifiers and a connection count.
 */
@RestController
@RequestMapping(path = "/realtime", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RealtimeController {

	private final RealtimeHub hub;

	public RealtimeController(RealtimeHub hub) {
		this.hub = hub;
	}

	@PostMapping(path = "/broadcast", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<BroadcastResponse> broadcast(@Valid @RequestBody BroadcastRequest req) {
		return hub.broadcast(new RealtimeMessage(req.type(), req.payload()))
				.map(delivered -> new BroadcastResponse(true, delivered));
	}

	@GetMapping("/status")
	public HubStatus status() {
		return new HubStatus(hub.connectedCount());
	}

	public record BroadcastRequest(@NotBlank String type, JsonNode payload) {
	}

	public record BroadcastResponse(boolean success, int delivered) {
	}

	public record HubStatus(int connectedClients) {
	}
}
