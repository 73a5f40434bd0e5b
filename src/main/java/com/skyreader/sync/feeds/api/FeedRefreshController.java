package com.skyreader.sync.feeds.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.skyreader.sync.feeds.refresh.FeedRefreshScheduler;
import com.skyreader.sync.feeds.refresh.FeedRefreshScheduler.RefresherStatus;
import com.skyreader.sync.feeds.refresh.FeedRefreshScheduler.TriggerResult;

import reactor.core.publisher.Mono;

/**
 * Operational control of scheduled feed refresh. Internal surface: keep it behind network controls.
 */
@RestController
@RequestMapping(path = "/feeds/refresher", produces = MediaType.APPLICATION_JSON_VALUE)
public class FeedRefreshController {

	private final FeedRefreshScheduler scheduler;

	public FeedRefreshController(FeedRefreshScheduler scheduler) {
		this.scheduler = scheduler;
	}

	@PostMapping("/trigger")
	public Mono<TriggerResult> trigger() {
		return scheduler.trigger();
	}

	@GetMapping("/status")
	public Mono<RefresherStatus> status() {
		return scheduler.status();
	}
}
