package com.skyreader.sync.feeds.fetch;

/**
 * Outcome of one conditional feed request that reached the origin.
 *
 * @param status       what happened
 * @param body         response bytes, only for {@link Status#OK}
 * @param etag         {@code ETag} response header, may be null
 * @param lastModified {@code Last-Modified} response header, may be null
 */
public record FetchResult(Status status, byte[] body, String etag, String lastModified) {

    public enum Status {
        OK,
        NOT_MODIFIED,
        /** Declared or actual size above the configured cap; the body was not kept. */
        TOO_LARGE
    }

    public static FetchResult ok(byte[] body, String etag, String lastModified) {
        return new FetchResult(Status.OK, body, etag, lastModified);
    }

    public static FetchResult notModified() {
        return new FetchResult(Status.NOT_MODIFIED, null, null, null);
    }

    public static FetchResult tooLarge() {
        return new FetchResult(Status.TOO_LARGE, null, null, null);
    }
}
