package com.skyreader.sync.feeds.fetch;

/**
 * A feed request failed: non-2xx status, timeout or transport error.
 */
public class FeedFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String feedUrl;

    public FeedFetchException(String feedUrl, String message) {
        super(message);
        this.feedUrl = feedUrl;
    }

    public FeedFetchException(String feedUrl, String message, Throwable cause) {
        super(message, cause);
        this.feedUrl = feedUrl;
    }

    public String getFeedUrl() {
        return feedUrl;
    }
}
