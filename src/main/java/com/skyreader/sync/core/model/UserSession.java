package com.skyreader.sync.core.model;

/**
 * Resolved client session. Only the identity is needed by the realtime hub.
 */
public record UserSession(String did) {
}
