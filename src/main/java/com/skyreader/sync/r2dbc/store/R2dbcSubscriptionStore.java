package com.skyreader.sync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.RefreshCandidate;
import com.skyreader.sync.core.store.SubscriptionStore;

import reactor.core.publisher.Flux;

/**
 * Read side of {@code subscriptions_cache}.
 */
@Repository
public class R2dbcSubscriptionStore implements SubscriptionStore {

	private static final String CANDIDATES = "SELECT s.feed_url, COUNT(DISTINCT s.user_did) AS subscriber_count, "
			+ "COALESCE(fm.error_count, 0) AS error_count, fm.last_scheduled_fetch_at, fm.etag, fm.last_modified "
			+ "FROM subscriptions_cache s "
			+ "JOIN users u ON u.did = s.user_did "
			+ "LEFT JOIN feed_metadata fm ON fm.feed_url = s.feed_url "
			+ "WHERE u.last_active_at >= :since AND COALESCE(fm.error_count, 0) < :max_errors "
			+ "GROUP BY s.feed_url, fm.error_count, fm.last_scheduled_fetch_at, fm.etag, fm.last_modified "
			+ "ORDER BY fm.last_scheduled_fetch_at ASC NULLS FIRST, subscriber_count DESC "
			+ "LIMIT :limit";

	private final DatabaseClient db;

	public R2dbcSubscriptionStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Flux<String> subscribersOf(String feedUrl) {
		return db.sql("SELECT DISTINCT user_did FROM subscriptions_cache WHERE feed_url = :feed_url")
				.bind("feed_url", feedUrl).map((row, meta) -> row.get("user_did", String.class)).all();
	}

	@Override
	public Flux<RefreshCandidate> refreshCandidates(Instant activeSince, int maxErrorCount, int limit) {
		return db.sql(CANDIDATES).bind("since", activeSince).bind("max_errors", maxErrorCount).bind("limit", limit)
				.map((row, meta) -> {
					Number subscribers = row.get("subscriber_count", Number.class);
					Number errors = row.get("error_count", Number.class);
					return new RefreshCandidate(
							row.get("feed_url", String.class),
							subscribers == null ? 0 : subscribers.intValue(),
							errors == null ? 0 : errors.intValue(),
							row.get("last_scheduled_fetch_at", Instant.class),
							row.get("etag", String.class),
							row.get("last_modified", String.class));
				}).all();
	}
}
