package com.skyreader.sync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.core.store.FeedMetadataStore;

import reactor.core.publisher.Mono;

/**
 * {@code feed_metadata} table. Each write is an upsert so the row appears on the first fetch attempt.
 */
@Repository
public class R2dbcFeedMetadataStore implements FeedMetadataStore {

	private static final int MAX_ERROR_MESSAGE = 500;

	private final DatabaseClient db;

	public R2dbcFeedMetadataStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<Void> recordSuccess(String feedUrl, ParsedFeed feed, String etag, String lastModified,
			int subscriberCount, Instant now) {
		String sql = "INSERT INTO feed_metadata (feed_url, title, site_url, description, last_fetched_at, "
				+ "last_scheduled_fetch_at, subscriber_count, etag, last_modified, fetch_error, error_count, created_at) "
				+ "VALUES (:feed_url, :title, :site_url, :description, :fetched_at, :scheduled_at, :subscriber_count, "
				+ ":etag, :last_modified, NULL, 0, :created_at) "
				+ "ON CONFLICT (feed_url) DO UPDATE SET title = EXCLUDED.title, site_url = EXCLUDED.site_url, "
				+ "description = EXCLUDED.description, last_fetched_at = EXCLUDED.last_fetched_at, "
				+ "last_scheduled_fetch_at = EXCLUDED.last_scheduled_fetch_at, "
				+ "subscriber_count = EXCLUDED.subscriber_count, etag = EXCLUDED.etag, "
				+ "last_modified = EXCLUDED.last_modified, fetch_error = NULL, error_count = 0";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("feed_url", feedUrl).bind("fetched_at", now)
				.bind("scheduled_at", now).bind("subscriber_count", subscriberCount).bind("created_at", now);
		spec = Binds.nullable(spec, "title", feed.title(), String.class);
		spec = Binds.nullable(spec, "site_url", feed.siteUrl(), String.class);
		spec = Binds.nullable(spec, "description", feed.description(), String.class);
		spec = Binds.nullable(spec, "etag", etag, String.class);
		spec = Binds.nullable(spec, "last_modified", lastModified, String.class);

		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> recordNotModified(String feedUrl, int subscriberCount, Instant now) {
		String sql = "INSERT INTO feed_metadata (feed_url, last_scheduled_fetch_at, subscriber_count, created_at) "
				+ "VALUES (:feed_url, :scheduled_at, :subscriber_count, :created_at) "
				+ "ON CONFLICT (feed_url) DO UPDATE SET last_scheduled_fetch_at = EXCLUDED.last_scheduled_fetch_at, "
				+ "subscriber_count = EXCLUDED.subscriber_count";
		return db.sql(sql).bind("feed_url", feedUrl).bind("scheduled_at", now)
				.bind("subscriber_count", subscriberCount).bind("created_at", now).fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> recordError(String feedUrl, String message, Instant now) {
		String sql = "INSERT INTO feed_metadata (feed_url, fetch_error, error_count, last_scheduled_fetch_at, created_at) "
				+ "VALUES (:feed_url, :fetch_error, 1, :scheduled_at, :created_at) "
				+ "ON CONFLICT (feed_url) DO UPDATE SET error_count = feed_metadata.error_count + 1, "
				+ "fetch_error = EXCLUDED.fetch_error, last_scheduled_fetch_at = EXCLUDED.last_scheduled_fetch_at";
		String text = message == null ? "unknown error" : message;
		if (text.length() > MAX_ERROR_MESSAGE) {
			text = text.substring(0, MAX_ERROR_MESSAGE);
		}
		return db.sql(sql).bind("feed_url", feedUrl).bind("fetch_error", text).bind("scheduled_at", now)
				.bind("created_at", now).fetch().rowsUpdated().then();
	}
}
