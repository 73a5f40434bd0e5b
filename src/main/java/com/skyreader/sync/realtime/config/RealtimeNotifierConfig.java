package com.skyreader.sync.realtime.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.skyreader.sync.core.notify.RealtimeNotifier;
import com.skyreader.sync.realtime.hub.RealtimeHub;
import com.skyreader.sync.realtime.notify.HttpRealtimeNotifier;
import com.skyreader.sync.realtime.notify.InProcessRealtimeNotifier;

/**
 * Chooses how ingestion and feed refresh reach the hub: directly when {@code hub-url} is blank, over HTTP
 * otherwise.
 */
@Configuration
public class RealtimeNotifierConfig {

	private static final Logger log = LoggerFactory.getLogger(RealtimeNotifierConfig.class);

	@Bean
	public RealtimeNotifier realtimeNotifier(RealtimeProperties props, RealtimeHub hub, WebClient.Builder builder) {
		String hubUrl = props.getHubUrl();
		if (hubUrl == null || hubUrl.isBlank()) {
			log.info("Realtime notifications go to the in-process hub");
			return new InProcessRealtimeNotifier(hub);
		}
		log.info("Realtime notifications go to remote hub url={}", hubUrl);
		return new HttpRealtimeNotifier(builder, hubUrl, props.getNotifyTimeout());
	}
}
