package com.skyreader.sync.core.model;

/**
 * Public profile fields resolved for a DID. Any field except {@code did} may be null.
 */
public record Profile(String did, String handle, String displayName, String avatarUrl) {
}
