package com.skyreader.sync.jetstream.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Firehose subscription settings.
 *
 * <pre>
 * skyreader:
 *   jetstream:
 *     endpoint: wss://jetstream2.us-east.bsky.network/subscribe
 *     poller:
 *       interval: 60s
 *       idle-timeout: 2s
 *       hard-timeout: 8s
 *     live:
 *       enabled: false
 * </pre>
 */
@ConfigurationProperties(prefix = "skyreader.jetstream")
public class JetstreamProperties {

	/**
	 * Subscription endpoint (the {@code /subscribe} path of a Jetstream instance).
	 */
	private String endpoint = "wss://jetstream2.us-east.bsky.network/subscribe";

	/**
	 * Rewind applied to a stored cursor on every (re)connect so redelivered events are replayed, not lost.
	 */
	private Duration overlap = Duration.ofSeconds(5);

	private Poller poller = new Poller();

	private Live live = new Live();

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public Duration getOverlap() {
		return overlap;
	}

	public void setOverlap(Duration overlap) {
		this.overlap = overlap;
	}

	public Poller getPoller() {
		return poller;
	}

	public void setPoller(Poller poller) {
		this.poller = poller;
	}

	public Live getLive() {
		return live;
	}

	public void setLive(Live live) {
		this.live = live;
	}

	/**
	 * Bounded poll cycles: connect, drain until caught up, persist the cursor, disconnect.
	 */
	public static class Poller {

		/** Schedule the first cycle at startup. */
		private boolean autoStart = true;

		/** Delay between the end of one invocation and the start of the next. */
		private Duration interval = Duration.ofSeconds(60);

		/** No frames of any kind for this long means the stream is caught up. */
		private Duration idleTimeout = Duration.ofSeconds(2);

		/** Upper bound on one stream's cycle regardless of traffic. */
		private Duration hardTimeout = Duration.ofSeconds(8);

		/** Cap on {@code wantedDids} for follow polls, keeping the subscription URL bounded. */
		private int maxWantedDids = 100;

		/** Users seen within this window are "active". */
		private Duration activeWindow = Duration.ofDays(7);

		public boolean isAutoStart() { return autoStart; }
		public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

		public Duration getInterval() { return interval; }
		public void setInterval(Duration interval) { this.interval = interval; }

		public Duration getIdleTimeout() { return idleTimeout; }
		public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

		public Duration getHardTimeout() { return hardTimeout; }
		public void setHardTimeout(Duration hardTimeout) { this.hardTimeout = hardTimeout; }

		public int getMaxWantedDids() { return maxWantedDids; }
		public void setMaxWantedDids(int maxWantedDids) { this.maxWantedDids = maxWantedDids; }

		public Duration getActiveWindow() { return activeWindow; }
		public void setActiveWindow(Duration activeWindow) { this.activeWindow = activeWindow; }
	}

	/**
	 * Long-lived consumer filtered by the watched identity set.
	 */
	public static class Live {

		private boolean enabled = false;

		/** Upstream enforces roughly this many {@code wantedDids}. */
		private int maxWatchedDids = 10_000;

		/** Lease refresh / reconnect check period. */
		private Duration keepalive = Duration.ofSeconds(30);

		private Duration reconnectDelay = Duration.ofSeconds(5);

		public boolean isEnabled() { return enabled; }
		public void setEnabled(boolean enabled) { this.enabled = enabled; }

		public int getMaxWatchedDids() { return maxWatchedDids; }
		public void setMaxWatchedDids(int maxWatchedDids) { this.maxWatchedDids = maxWatchedDids; }

		public Duration getKeepalive() { return keepalive; }
		public void setKeepalive(Duration keepalive) { this.keepalive = keepalive; }

		public Duration getReconnectDelay() { return reconnectDelay; }
		public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }
	}
}
