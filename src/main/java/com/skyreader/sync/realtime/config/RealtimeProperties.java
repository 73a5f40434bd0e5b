package com.skyreader.sync.realtime.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Realtime hub settings.
 */
@ConfigurationProperties(prefix = "skyreader.realtime")
public class RealtimeProperties {

	/** WebSocket upgrade path. */
	private String path = "/api/realtime";

	private Duration heartbeatInterval = Duration.ofSeconds(30);

	/** A connection silent for longer than this is closed by the next sweep (three missed probes). */
	private Duration heartbeatTimeout = Duration.ofSeconds(90);

	/** Idle time after which the in-memory connection index is dropped and rebuilt on demand. */
	private Duration hibernateAfter = Duration.ofMinutes(5);

	/**
	 * Base URL of a remote hub. Blank means the hub in this process receives notifications directly.
	 */
	private String hubUrl = "";

	private Duration notifyTimeout = Duration.ofSeconds(3);

	public String getPath() { return path; }
	public void setPath(String path) { this.path = path; }

	public Duration getHeartbeatInterval() { return heartbeatInterval; }
	public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

	public Duration getHeartbeatTimeout() { return heartbeatTimeout; }
	public void setHeartbeatTimeout(Duration heartbeatTimeout) { this.heartbeatTimeout = heartbeatTimeout; }

	public Duration getHibernateAfter() { return hibernateAfter; }
	public void setHibernateAfter(Duration hibernateAfter) { this.hibernateAfter = hibernateAfter; }

	public String getHubUrl() { return hubUrl; }
	public void setHubUrl(String hubUrl) { this.hubUrl = hubUrl; }

	public Duration getNotifyTimeout() { return notifyTimeout; }
	public void setNotifyTimeout(Duration notifyTimeout) { this.notifyTimeout = notifyTimeout; }
}
