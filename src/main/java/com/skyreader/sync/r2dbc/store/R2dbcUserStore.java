package com.skyreader.sync.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.Profile;
import com.skyreader.sync.core.store.UserStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code users} table.
 */
@Repository
public class R2dbcUserStore implements UserStore {

	private final DatabaseClient db;

	public R2dbcUserStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<Void> ensureExists(String did, Instant now) {
		String sql = "INSERT INTO users (did, handle, pds_url, created_at, updated_at) "
				+ "VALUES (:did, :handle, '', :created_at, :updated_at) ON CONFLICT (did) DO NOTHING";
		return db.sql(sql).bind("did", did).bind("handle", did).bind("created_at", now).bind("updated_at", now)
				.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> upsertProfile(Profile profile, Instant now) {
		String sql = "INSERT INTO users (did, handle, display_name, avatar_url, pds_url, created_at, updated_at) "
				+ "VALUES (:did, :handle, :display_name, :avatar_url, '', :created_at, :updated_at) "
				+ "ON CONFLICT (did) DO UPDATE SET "
				+ "handle = CASE WHEN EXCLUDED.handle <> EXCLUDED.did THEN EXCLUDED.handle ELSE users.handle END, "
				+ "display_name = COALESCE(EXCLUDED.display_name, users.display_name), "
				+ "avatar_url = COALESCE(EXCLUDED.avatar_url, users.avatar_url), "
				+ "updated_at = EXCLUDED.updated_at";

		String handle = profile.handle() == null || profile.handle().isBlank() ? profile.did() : profile.handle();

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("did", profile.did()).bind("handle", handle)
				.bind("created_at", now).bind("updated_at", now);
		spec = Binds.nullable(spec, "display_name", profile.displayName(), String.class);
		spec = Binds.nullable(spec, "avatar_url", profile.avatarUrl(), String.class);

		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Flux<String> activeDids(Instant since, int limit) {
		String sql = "SELECT did FROM users WHERE pds_url <> '' AND last_active_at >= :since "
				+ "ORDER BY last_active_at DESC LIMIT :limit";
		return db.sql(sql).bind("since", since).bind("limit", limit)
				.map((row, meta) -> row.get("did", String.class)).all();
	}

	@Override
	public Flux<String> knownDids(int limit) {
		String sql = "SELECT did FROM users ORDER BY last_active_at DESC NULLS LAST LIMIT :limit";
		return db.sql(sql).bind("limit", limit).map((row, meta) -> row.get("did", String.class)).all();
	}
}
