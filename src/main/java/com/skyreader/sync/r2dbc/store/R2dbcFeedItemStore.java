package com.skyreader.sync.r2dbc.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ItemStoreResult;
import com.skyreader.sync.core.store.FeedItemStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code feed_items} table.
 *
 * <p>Each item is upserted on {@code (feed_url, guid)}; an existing row is only rewritten when its content hash
 * changed. {@code RETURNING (xmax = 0)} tells a fresh insert apart from an update, which is how new items are
 * counted without a read-before-write race.</p>
 */
@Repository
public class R2dbcFeedItemStore implements FeedItemStore {

	private static final String UPSERT = "INSERT INTO feed_items (feed_url, guid, url, title, author, summary, content, "
			+ "image_url, published_at, fetched_at, content_hash) VALUES (:feed_url, :guid, :url, :title, :author, "
			+ ":summary, :content, :image_url, :published_at, :fetched_at, :content_hash) "
			+ "ON CONFLICT (feed_url, guid) DO UPDATE SET url = EXCLUDED.url, title = EXCLUDED.title, "
			+ "author = EXCLUDED.author, summary = EXCLUDED.summary, content = EXCLUDED.content, "
			+ "image_url = EXCLUDED.image_url, published_at = EXCLUDED.published_at, "
			+ "fetched_at = EXCLUDED.fetched_at, content_hash = EXCLUDED.content_hash "
			+ "WHERE feed_items.content_hash IS DISTINCT FROM EXCLUDED.content_hash "
			+ "RETURNING (xmax = 0) AS inserted";

	private final DatabaseClient db;

	public R2dbcFeedItemStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<ItemStoreResult> storeItems(String feedUrl, List<FeedEntry> items, Instant now) {
		Mono<Long> existing = db.sql("SELECT COUNT(*) AS n FROM feed_items WHERE feed_url = :feed_url")
				.bind("feed_url", feedUrl).map((row, meta) -> {
					Number n = row.get("n", Number.class);
					return n == null ? 0L : n.longValue();
				}).one().defaultIfEmpty(0L);

		return existing.flatMap(before -> Flux.fromIterable(items)
				.concatMap(item -> upsert(feedUrl, item, now))
				.filter(Boolean::booleanValue)
				.count()
				.map(inserted -> new ItemStoreResult(inserted.intValue(), before == 0 && !items.isEmpty())));
	}

	private Mono<Boolean> upsert(String feedUrl, FeedEntry item, Instant now) {
		DatabaseClient.GenericExecuteSpec spec = db.sql(UPSERT).bind("feed_url", feedUrl).bind("guid", item.guid())
				.bind("fetched_at", now).bind("content_hash", contentHash(item));
		spec = Binds.nullable(spec, "url", item.url(), String.class);
		spec = Binds.nullable(spec, "title", item.title(), String.class);
		spec = Binds.nullable(spec, "author", item.author(), String.class);
		spec = Binds.nullable(spec, "summary", item.summary(), String.class);
		spec = Binds.nullable(spec, "content", item.content(), String.class);
		spec = Binds.nullable(spec, "image_url", item.imageUrl(), String.class);
		spec = Binds.nullable(spec, "published_at", item.publishedAt(), Instant.class);

		return spec.map((row, meta) -> Boolean.TRUE.equals(row.get("inserted", Boolean.class))).one()
				.defaultIfEmpty(false);
	}

	static String contentHash(FeedEntry item) {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			for (String part : new String[] { item.url(), item.title(), item.summary(), item.content(),
					item.imageUrl() }) {
				md.update((part == null ? "" : part).getBytes(StandardCharsets.UTF_8));
				md.update((byte) 0);
			}
			return HexFormat.of().formatHex(md.digest());
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 unavailable", e);
		}
	}
}
