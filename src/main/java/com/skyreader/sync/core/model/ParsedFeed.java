package com.skyreader.sync.core.model;

import java.util.List;

/**
 * Result of parsing one feed document.
 */
public record ParsedFeed(String title, String siteUrl, String description, List<FeedEntry> items) {

    public ParsedFeed {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public ParsedFeed withItems(List<FeedEntry> newItems) {
        return new ParsedFeed(title, siteUrl, description, newItems);
    }
}
