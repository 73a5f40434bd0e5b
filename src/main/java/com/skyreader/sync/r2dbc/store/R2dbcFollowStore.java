package com.skyreader.sync.r2dbc.store;

import java.time.Clock;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.skyreader.sync.core.model.FollowEdge;
import com.skyreader.sync.core.model.FollowGraph;
import com.skyreader.sync.core.store.FollowStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@code follows_cache} and {@code inapp_follows}. Table names come from {@link FollowGraph}, never from input.
 */
@Repository
public class R2dbcFollowStore implements FollowStore {

	private final DatabaseClient db;
	private final Clock clock;

	public R2dbcFollowStore(DatabaseClient db, Clock clock) {
		this.db = db;
		this.clock = clock;
	}

	@Override
	public Mono<Void> upsert(FollowGraph graph, FollowEdge edge) {
		if (graph == FollowGraph.INAPP) {
			String sql = "INSERT INTO inapp_follows (follower_did, following_did, rkey, record_uri, created_at) "
					+ "VALUES (:follower_did, :following_did, :rkey, :record_uri, :created_at) "
					+ "ON CONFLICT (follower_did, following_did) DO UPDATE SET rkey = EXCLUDED.rkey, "
					+ "record_uri = EXCLUDED.record_uri";
			return db.sql(sql).bind("follower_did", edge.followerDid()).bind("following_did", edge.followingDid())
					.bind("rkey", edge.rkey()).bind("record_uri", edge.recordUri().toString())
					.bind("created_at", clock.instant()).fetch().rowsUpdated().then();
		}

		String sql = "INSERT INTO follows_cache (follower_did, following_did, rkey, created_at) "
				+ "VALUES (:follower_did, :following_did, :rkey, :created_at) "
				+ "ON CONFLICT (follower_did, following_did) DO UPDATE SET rkey = EXCLUDED.rkey";
		return db.sql(sql).bind("follower_did", edge.followerDid()).bind("following_did", edge.followingDid())
				.bind("rkey", edge.rkey()).bind("created_at", clock.instant()).fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Boolean> delete(FollowGraph graph, String followerDid, String rkey) {
		String sql = "DELETE FROM " + graph.table() + " WHERE follower_did = :follower_did AND rkey = :rkey";
		return db.sql(sql).bind("follower_did", followerDid).bind("rkey", rkey).fetch().rowsUpdated()
				.map(n -> n > 0);
	}

	@Override
	public Flux<String> followersOf(String did) {
		String sql = "SELECT follower_did FROM follows_cache WHERE following_did = :did_a "
				+ "UNION SELECT follower_did FROM inapp_follows WHERE following_did = :did_b";
		return db.sql(sql).bind("did_a", did).bind("did_b", did)
				.map((row, meta) -> row.get("follower_did", String.class)).all();
	}
}
