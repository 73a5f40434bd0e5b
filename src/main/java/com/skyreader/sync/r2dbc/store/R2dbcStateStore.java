package com.skyreader.sync.r2dbc.store;

import java.time.Clock;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.store.StateStore;

import reactor.core.publisher.Mono;

/**
 * {@code sync_state} table: cursors, alarms, stats and cycle state, one row per key.
 */
@Repository
public class R2dbcStateStore implements StateStore {

	private final DatabaseClient db;
	private final Clock clock;

	public R2dbcStateStore(DatabaseClient db, Clock clock) {
		this.db = db;
		this.clock = clock;
	}

	@Override
	public Mono<String> get(String key) {
		return db.sql("SELECT value FROM sync_state WHERE key = :key").bind("key", key)
				.map((row, meta) -> row.get("value", String.class)).one();
	}

	@Override
	public Mono<Void> put(String key, String value) {
		String sql = "INSERT INTO sync_state (key, value, updated_at) VALUES (:key, :value, :updated_at) "
				+ "ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = EXCLUDED.updated_at";
		return db.sql(sql).bind("key", key).bind("value", value).bind("updated_at", clock.instant()).fetch()
				.rowsUpdated().then();
	}

	@Override
	public Mono<Void> delete(String key) {
		return db.sql("DELETE FROM sync_state WHERE key = :key").bind("key", key).fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Boolean> deleteIfValue(String key, String expected) {
		return db.sql("DELETE FROM sync_state WHERE key = :key AND value = :value").bind("key", key)
				.bind("value", expected).fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Boolean> replaceIfValue(String key, String expected, String value) {
		String sql = "UPDATE sync_state SET value = :value, updated_at = :updated_at "
				+ "WHERE key = :key AND value = :expected";
		return db.sql(sql).bind("key", key).bind("expected", expected).bind("value", value)
				.bind("updated_at", clock.instant()).fetch().rowsUpdated().map(n -> n > 0);
	}
}
