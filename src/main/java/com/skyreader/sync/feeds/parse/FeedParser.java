package com.skyreader.sync.feeds.parse;

import com.skyreader.sync.core.model.ParsedFeed;

/**
 * Pure function from a fetched document to a {@link ParsedFeed}.
 */
public interface FeedParser {

    /**
     * @param body    raw response bytes
     * @param feedUrl URL the document was fetched from, used in error messages
     * @throws FeedParseException when the document is not RSS, Atom, RDF or JSON Feed
     */
    ParsedFeed parse(byte[] body, String feedUrl);
}
