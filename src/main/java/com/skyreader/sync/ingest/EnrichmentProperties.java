package com.skyreader.sync.ingest;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Best-effort lookups performed while applying commits. Timeouts are deliberately shorter than a poll
 * cycle's hard timeout.
 */
@ConfigurationProperties(prefix = "skyreader.enrichment")
public class EnrichmentProperties {

	private String profileEndpoint = "https://public.api.bsky.app/xrpc/app.bsky.actor.getProfile";

	private Duration profileTimeout = Duration.ofSeconds(5);

	private Duration contentTimeout = Duration.ofSeconds(5);

	public String getProfileEndpoint() { return profileEndpoint; }
	public void setProfileEndpoint(String profileEndpoint) { this.profileEndpoint = profileEndpoint; }

	public Duration getProfileTimeout() { return profileTimeout; }
	public void setProfileTimeout(Duration profileTimeout) { this.profileTimeout = profileTimeout; }

	public Duration getContentTimeout() { return contentTimeout; }
	public void setContentTimeout(Duration contentTimeout) { this.contentTimeout = contentTimeout; }
}
