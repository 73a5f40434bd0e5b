package com.skyreader.sync.core.model;

import java.util.Objects;

/**
 * Natural key of one versioned repository record: {@code at://<did>/<collection>/<rkey>}.
 */
public record RecordUri(String did, String collection, String rkey) {

    private static final String SCHEME = "at://";

    public RecordUri {
        requirePart(did, "did");
        requirePart(collection, "collection");
        requirePart(rkey, "rkey");
    }

    public static RecordUri parse(String uri) {
        Objects.requireNonNull(uri, "uri");
        if (!uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not an at:// uri: " + uri);
        }
        String[] parts = uri.substring(SCHEME.length()).split("/");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected at://did/collection/rkey but was: " + uri);
        }
        return new RecordUri(parts[0], parts[1], parts[2]);
    }

    @Override
    public String toString() {
        return SCHEME + did + "/" + collection + "/" + rkey;
    }

    private static void requirePart(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.indexOf('/') >= 0) {
            throw new IllegalArgumentException(name + " must not contain '/': " + value);
        }
    }
}
