package com.skyreader.sync.consumer.api;

import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.skyreader.sync.consumer.LiveCommitConsumer;
import com.skyreader.sync.consumer.LiveCommitConsumer.LiveStatus;
import com.skyreader.sync.consumer.WatchedIdentitySet;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import reactor.core.publisher.Mono;

/**
 * Control of the live firehose consumer. Only present when the consumer is enabled.
 */
@RestController
@RequestMapping(path = "/jetstream/consumer", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "skyreader.jetstream.live", name = "enabled", havingValue = "true")
@Validated
public class LiveConsumerController {

	private final LiveCommitConsumer consumer;

	public LiveConsumerController(LiveCommitConsumer consumer) {
		this.consumer = consumer;
	}

	@GetMapping("/status")
	public Mono<LiveStatus> status() {
		return consumer.status();
	}

	@PostMapping("/reconnect")
	public Map<String, Object> reconnect() {
		consumer.reconnect();
		return Map.of("success", true);
	}

	@PostMapping(path = "/register-did", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<RegisterDidResponse> registerDid(@Valid @RequestBody RegisterDidRequest req) {
		return consumer.registerDid(req.did()).map(result -> {
			if (result == WatchedIdentitySet.AddResult.FULL) {
				throw new ResponseStatusException(HttpStatus.CONFLICT, "Watched identity set is full");
			}
			return new RegisterDidResponse(true, result == WatchedIdentitySet.AddResult.ADDED);
		});
	}

	public record RegisterDidRequest(
			@NotBlank @Pattern(regexp = "^did:[a-z]+:[A-Za-z0-9._:%-]+$", message = "must be a DID") String did) {
	}

	public record RegisterDidResponse(boolean success, boolean added) {
	}
}
