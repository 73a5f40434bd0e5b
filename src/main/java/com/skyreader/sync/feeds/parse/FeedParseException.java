package com.skyreader.sync.feeds.parse;

/**
 * The fetched document is not a feed this service can read.
 */
public class FeedParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
