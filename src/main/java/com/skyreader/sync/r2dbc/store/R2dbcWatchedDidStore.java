package com.skyreader.sync.r2dbc.store;

import java.time.Clock;
import java.util.Collection;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.store.WatchedDidStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code watched_dids} table.
 */
@Repository
public class R2dbcWatchedDidStore implements WatchedDidStore {

	private final DatabaseClient db;
	private final Clock clock;

	public R2dbcWatchedDidStore(DatabaseClient db, Clock clock) {
		this.db = db;
		this.clock = clock;
	}

	@Override
	public Flux<String> findAll(int limit) {
		return db.sql("SELECT did FROM watched_dids ORDER BY added_at ASC LIMIT :limit").bind("limit", limit)
				.map((row, meta) -> row.get("did", String.class)).all();
	}

	@Override
	public Mono<Boolean> add(String did) {
		return db.sql("INSERT INTO watched_dids (did, added_at) VALUES (:did, :added_at) ON CONFLICT (did) DO NOTHING")
				.bind("did", did).bind("added_at", clock.instant()).fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Void> addAll(Collection<String> dids) {
		return Flux.fromIterable(dids).concatMap(this::add).then();
	}
}
