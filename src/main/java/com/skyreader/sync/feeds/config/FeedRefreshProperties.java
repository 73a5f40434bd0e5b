package com.skyreader.sync.feeds.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Budgets for scheduled feed refresh. Defaults keep one cycle well inside shared outbound and CPU limits.
 */
@ConfigurationProperties(prefix = "skyreader.feeds")
public class FeedRefreshProperties {

	/** Schedule the periodic trigger alarm at startup. */
	private boolean autoStart = true;

	private int maxFeedsPerCycle = 50;

	/** Concurrent fetches per batch. */
	private int batchSize = 5;

	private Duration batchDelay = Duration.ofSeconds(2);

	/** Subscribers must have been active within this window for their feeds to be refreshed. */
	private Duration activeWindow = Duration.ofDays(7);

	/** Feeds whose consecutive error count reached this value are no longer selected. */
	private int maxErrorCount = 10;

	/** Declared or actual response size above which a fetch is abandoned. */
	private int maxFeedBytes = 2 * 1024 * 1024;

	/** Ceiling for the serialized payload in {@code feed_cache} and for resolved article content. */
	private int maxCachedContentChars = 500_000;

	/** Parsed items kept per feed document. */
	private int maxItems = 100;

	private Duration fetchTimeout = Duration.ofSeconds(10);

	/** Age after which a cached feed is considered stale by content enrichment. */
	private Duration contentCacheTtl = Duration.ofMinutes(15);

	private Duration triggerInterval = Duration.ofMinutes(15);

	private String userAgent = "Skyreader/1.0 (+https://skyreader.app)";

	public boolean isAutoStart() { return autoStart; }
	public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

	public int getMaxFeedsPerCycle() { return maxFeedsPerCycle; }
	public void setMaxFeedsPerCycle(int maxFeedsPerCycle) { this.maxFeedsPerCycle = maxFeedsPerCycle; }

	public int getBatchSize() { return batchSize; }
	public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

	public Duration getBatchDelay() { return batchDelay; }
	public void setBatchDelay(Duration batchDelay) { this.batchDelay = batchDelay; }

	public Duration getActiveWindow() { return activeWindow; }
	public void setActiveWindow(Duration activeWindow) { this.activeWindow = activeWindow; }

	public int getMaxErrorCount() { return maxErrorCount; }
	public void setMaxErrorCount(int maxErrorCount) { this.maxErrorCount = maxErrorCount; }

	public int getMaxFeedBytes() { return maxFeedBytes; }
	public void setMaxFeedBytes(int maxFeedBytes) { this.maxFeedBytes = maxFeedBytes; }

	public int getMaxCachedContentChars() { return maxCachedContentChars; }
	public void setMaxCachedContentChars(int maxCachedContentChars) { this.maxCachedContentChars = maxCachedContentChars; }

	public int getMaxItems() { return maxItems; }
	public void setMaxItems(int maxItems) { this.maxItems = maxItems; }

	public Duration getFetchTimeout() { return fetchTimeout; }
	public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

	public Duration getContentCacheTtl() { return contentCacheTtl; }
	public void setContentCacheTtl(Duration contentCacheTtl) { this.contentCacheTtl = contentCacheTtl; }

	public Duration getTriggerInterval() { return triggerInterval; }
	public void setTriggerInterval(Duration triggerInterval) { this.triggerInterval = triggerInterval; }

	public String getUserAgent() { return userAgent; }
	public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
}
