package com.skyreader.sync.support;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.skyreader.sync.core.model.CachedFeed;
import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ItemStoreResult;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.core.store.FeedCacheStore;
import com.skyreader.sync.core.store.FeedItemStore;
import com.skyreader.sync.core.store.FeedMetadataStore;

import reactor.core.publisher.Mono;

/**
 * The three feed tables kept in maps. Each nested class implements one store interface.
 */
public final class InMemoryFeedStores {

    public final Metadata metadata = new Metadata();
    public final Cache cache = new Cache();
    public final Items items = new Items();

    public static final class Metadata implements FeedMetadataStore {

        public static final class Row {
            public String title;
            public String etag;
            public String lastModified;
            public int subscriberCount;
            public int errorCount;
            public String lastError;
            public Instant lastFetchedAt;
            public Instant lastScheduledFetchAt;
        }

        private final Map<String, Row> rows = new ConcurrentHashMap<>();

        @Override
        public Mono<Void> recordSuccess(String feedUrl, ParsedFeed feed, String etag, String lastModified,
                int subscriberCount, Instant now) {
            return Mono.fromRunnable(() -> {
                Row r = row(feedUrl);
                r.title = feed.title();
                r.etag = etag;
                r.lastModified = lastModified;
                r.subscriberCount = subscriberCount;
                r.errorCount = 0;
                r.lastError = null;
                r.lastFetchedAt = now;
                r.lastScheduledFetchAt = now;
            });
        }

        @Override
        public Mono<Void> recordNotModified(String feedUrl, int subscriberCount, Instant now) {
            return Mono.fromRunnable(() -> {
                Row r = row(feedUrl);
                r.subscriberCount = subscriberCount;
                r.lastScheduledFetchAt = now;
            });
        }

        @Override
        public Mono<Void> recordError(String feedUrl, String message, Instant now) {
            return Mono.fromRunnable(() -> {
                Row r = row(feedUrl);
                r.errorCount++;
                r.lastError = message;
            });
        }

        public Row get(String feedUrl) {
            return rows.get(feedUrl);
        }

        private Row row(String feedUrl) {
            return rows.computeIfAbsent(feedUrl, k -> new Row());
        }
    }

    public static final class Cache implements FeedCacheStore {

        private final Map<String, CachedFeed> rows = new ConcurrentHashMap<>();

        @Override
        public Mono<CachedFeed> find(String feedUrl) {
            return Mono.fromSupplier(() -> rows.get(feedUrl));
        }

        @Override
        public Mono<Void> put(CachedFeed feed) {
            return Mono.fromRunnable(() -> rows.put(feed.feedUrl(), feed));
        }

        @Override
        public Mono<Void> touch(String feedUrl, Instant now) {
            return Mono.fromRunnable(() -> rows.computeIfPresent(feedUrl, (k, c) ->
                    new CachedFeed(c.feedUrl(), c.content(), c.etag(), c.lastModified(), now)));
        }

        public CachedFeed get(String feedUrl) {
            return rows.get(feedUrl);
        }
    }

    public static final class Items implements FeedItemStore {

        private final Map<String, Map<String, FeedEntry>> rows = new ConcurrentHashMap<>();

        @Override
        public Mono<ItemStoreResult> storeItems(String feedUrl, List<FeedEntry> items, Instant now) {
            return Mono.fromSupplier(() -> {
                Map<String, FeedEntry> feed = rows.computeIfAbsent(feedUrl, k -> new LinkedHashMap<>());
                synchronized (feed) {
                    boolean initial = feed.isEmpty();
                    int added = 0;
                    for (FeedEntry item : items) {
                        if (feed.put(item.guid(), item) == null) {
                            added++;
                        }
                    }
                    return new ItemStoreResult(added, initial);
                }
            });
        }

        public int count(String feedUrl) {
            return rows.getOrDefault(feedUrl, Map.of()).size();
        }
    }
}
