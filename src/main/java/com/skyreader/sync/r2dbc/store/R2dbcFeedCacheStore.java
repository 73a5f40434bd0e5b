package com.skyreader.sync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.CachedFeed;
import com.skyreader.sync.core.store.FeedCacheStore;

import reactor.core.publisher.Mono;

/**
 * {@code feed_cache} table, keyed by feed URL.
 */
@Repository
public class R2dbcFeedCacheStore implements FeedCacheStore {

	private final DatabaseClient db;

	public R2dbcFeedCacheStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<CachedFeed> find(String feedUrl) {
		String sql = "SELECT feed_url, content, etag, last_modified, cached_at FROM feed_cache WHERE feed_url = :feed_url";
		return db.sql(sql).bind("feed_url", feedUrl)
				.map((row, meta) -> new CachedFeed(row.get("feed_url", String.class),
						Binds.asString(row.get("content")), row.get("etag", String.class),
						row.get("last_modified", String.class), row.get("cached_at", Instant.class)))
				.one();
	}

	@Override
	public Mono<Void> put(CachedFeed feed) {
		String sql = "INSERT INTO feed_cache (feed_url, content, etag, last_modified, cached_at) "
				+ "VALUES (:feed_url, :content, :etag, :last_modified, :cached_at) "
				+ "ON CONFLICT (feed_url) DO UPDATE SET content = EXCLUDED.content, etag = EXCLUDED.etag, "
				+ "last_modified = EXCLUDED.last_modified, cached_at = EXCLUDED.cached_at";
		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("feed_url", feed.feedUrl())
				.bind("content", feed.content()).bind("cached_at", feed.cachedAt());
		spec = Binds.nullable(spec, "etag", feed.etag(), String.class);
		spec = Binds.nullable(spec, "last_modified", feed.lastModified(), String.class);
		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> touch(String feedUrl, Instant now) {
		return db.sql("UPDATE feed_cache SET cached_at = :cached_at WHERE feed_url = :feed_url")
				.bind("cached_at", now).bind("feed_url", feedUrl).fetch().rowsUpdated().then();
	}
}
