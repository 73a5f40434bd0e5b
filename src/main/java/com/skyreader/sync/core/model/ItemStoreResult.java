package com.skyreader.sync.core.model;

/**
 * Outcome of persisting a feed's items.
 *
 * @param newCount        number of {@code (feed_url, guid)} pairs that did not exist before
 * @param initialImport   true when the feed had no stored items before this call
 */
public record ItemStoreResult(int newCount, boolean initialImport) {
}
