package com.skyreader.sync.poller.api;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.skyreader.sync.poller.PollingOrchestrator;
import com.skyreader.sync.poller.PollingOrchestrator.PollerStatus;

import reactor.core.publisher.Mono;

/**
 * Operational control of the periodic firehose poller.
 */
@RestController
@RequestMapping(path = "/jetstream/poller", produces = MediaType.APPLICATION_JSON_VALUE)
public class PollerController {

	private final PollingOrchestrator orchestrator;

	public PollerController(PollingOrchestrator orchestrator) {
		this.orchestrator = orchestrator;
	}

	@PostMapping("/start")
	public Mono<Map<String, String>> start() {
		return orchestrator.start().map(status -> Map.of("status", status));
	}

	@GetMapping("/status")
	public Mono<PollerStatus> status() {
		return orchestrator.status();
	}
}
