package com.skyreader.sync.core.session;

import com.skyreader.sync.core.model.UserSession;

import reactor.core.publisher.Mono;

/**
 * Looks up a client-presented session token.
 */
public interface SessionResolver {

    /**
     * @return the session, or an empty Mono for unknown, expired or malformed tokens
     */
    Mono<UserSession> resolve(String token);
}
