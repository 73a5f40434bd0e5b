package com.skyreader.sync.r2dbc.store;

import java.time.Clock;
import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.model.RecordUri;
import com.skyreader.sync.core.model.Share;
import com.skyreader.sync.core.store.ShareStore;

import reactor.core.publisher.Mono;

/**
 * {@code shares} table. Tags are stored as a JSON array string.
 */
@Repository
public class R2dbcShareStore implements ShareStore {

	private static final String UPSERT = "INSERT INTO shares (author_did, record_uri, record_cid, feed_url, item_url, "
			+ "item_title, item_author, item_description, item_image, item_guid, item_published_at, note, tags, "
			+ "content, indexed_at, created_at) VALUES (:author_did, :record_uri, :record_cid, :feed_url, :item_url, "
			+ ":item_title, :item_author, :item_description, :item_image, :item_guid, :item_published_at, :note, "
			+ ":tags, :content, :indexed_at, :created_at) "
			+ "ON CONFLICT (record_uri) DO UPDATE SET author_did = EXCLUDED.author_did, "
			+ "record_cid = EXCLUDED.record_cid, feed_url = EXCLUDED.feed_url, item_url = EXCLUDED.item_url, "
			+ "item_title = EXCLUDED.item_title, item_author = EXCLUDED.item_author, "
			+ "item_description = EXCLUDED.item_description, item_image = EXCLUDED.item_image, "
			+ "item_guid = EXCLUDED.item_guid, item_published_at = EXCLUDED.item_published_at, "
			+ "note = EXCLUDED.note, tags = EXCLUDED.tags, content = EXCLUDED.content, "
			+ "indexed_at = EXCLUDED.indexed_at, created_at = EXCLUDED.created_at";

	private final DatabaseClient db;
	private final ObjectMapper mapper;
	private final Clock clock;

	public R2dbcShareStore(DatabaseClient db, ObjectMapper mapper, Clock clock) {
		this.db = db;
		this.mapper = mapper;
		this.clock = clock;
	}

	@Override
	public Mono<Void> upsert(Share share) {
		DatabaseClient.GenericExecuteSpec spec = db.sql(UPSERT).bind("author_did", share.authorDid())
				.bind("record_uri", share.recordUri().toString()).bind("record_cid", share.recordCid())
				.bind("item_url", share.itemUrl()).bind("indexed_at", clock.instant())
				.bind("created_at", share.createdAt());

		spec = Binds.nullable(spec, "feed_url", share.feedUrl(), String.class);
		spec = Binds.nullable(spec, "item_title", share.itemTitle(), String.class);
		spec = Binds.nullable(spec, "item_author", share.itemAuthor(), String.class);
		spec = Binds.nullable(spec, "item_description", share.itemDescription(), String.class);
		spec = Binds.nullable(spec, "item_image", share.itemImage(), String.class);
		spec = Binds.nullable(spec, "item_guid", share.itemGuid(), String.class);
		spec = Binds.nullable(spec, "item_published_at", share.itemPublishedAt(), Instant.class);
		spec = Binds.nullable(spec, "note", share.note(), String.class);
		spec = Binds.nullable(spec, "tags", share.tags().isEmpty() ? null : writeTags(share), String.class);
		spec = Binds.nullable(spec, "content", share.content(), String.class);

		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Boolean> delete(RecordUri recordUri) {
		return db.sql("DELETE FROM shares WHERE record_uri = :record_uri").bind("record_uri", recordUri.toString())
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	private String writeTags(Share share) {
		try {
			return mapper.writeValueAsString(share.tags());
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Failed to serialize tags for " + share.recordUri(), e);
		}
	}
}
