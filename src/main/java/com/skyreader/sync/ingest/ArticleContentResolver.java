package com.skyreader.sync.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.model.CachedFeed;
import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.core.store.FeedCacheStore;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;
import com.skyreader.sync.feeds.fetch.FetchResult;
import com.skyreader.sync.feeds.fetch.FeedFetcher;
import com.skyreader.sync.feeds.parse.FeedCacheCodec;
import com.skyreader.sync.feeds.parse.FeedParser;

import reactor.core.publisher.Mono;

/**
 * Finds the full text of a shared article in its feed.
 *
 * <p>A fresh {@code feed_cache} entry is used when it contains the item; otherwise the feed is fetched, parsed
 * and cached. Items are matched by guid, then by URL. The article's content (or its summary when it has none)
 * is returned, capped at {@code maxCachedContentChars}.</p>
 *
 * <p>Never fails: any problem yields an empty Mono so the share is stored without content.</p>
 */
@Component
public class ArticleContentResolver {

    private static final Logger log = LoggerFactory.getLogger(ArticleContentResolver.class);

    private final FeedCacheStore cache;
    private final FeedFetcher fetcher;
    private final FeedParser parser;
    private final FeedCacheCodec codec;
    private final FeedRefreshProperties feeds;
    private final EnrichmentProperties enrichment;
    private final Clock clock;

    public ArticleContentResolver(FeedCacheStore cache, FeedFetcher fetcher, FeedParser parser, FeedCacheCodec codec,
            FeedRefreshProperties feeds, EnrichmentProperties enrichment, Clock clock) {
        this.cache = cache;
        this.fetcher = fetcher;
        this.parser = parser;
        this.codec = codec;
        this.feeds = feeds;
        this.enrichment = enrichment;
        this.clock = clock;
    }

    public Mono<String> resolve(String feedUrl, String itemGuid, String itemUrl) {
        return fromCache(feedUrl, itemGuid, itemUrl)
                .switchIfEmpty(Mono.defer(() -> fromOrigin(feedUrl, itemGuid, itemUrl)))
                .map(this::cap)
                .timeout(enrichment.getContentTimeout())
                .onErrorResume(err -> {
                    log.warn("Article content lookup failed feed={} guid={} err={}", feedUrl, itemGuid,
                            err.toString());
                    return Mono.empty();
                });
    }

    private Mono<String> fromCache(String feedUrl, String itemGuid, String itemUrl) {
        Instant now = clock.instant();
        Duration ttl = feeds.getContentCacheTtl();
        return cache.find(feedUrl)
                .filter(cached -> cached.cachedAt() != null && !cached.cachedAt().plus(ttl).isBefore(now))
                .flatMap(cached -> Mono.justOrEmpty(codec.decode(cached.content())
                        .flatMap(feed -> match(feed, itemGuid, itemUrl))));
    }

    private Mono<String> fromOrigin(String feedUrl, String itemGuid, String itemUrl) {
        return fetcher.fetch(feedUrl)
                .filter(result -> result.status() == FetchResult.Status.OK)
                .flatMap(result -> {
                    ParsedFeed feed = parser.parse(result.body(), feedUrl);
                    CachedFeed entry = new CachedFeed(feedUrl, codec.encode(feed), result.etag(),
                            result.lastModified(), clock.instant());
                    return cache.put(entry).then(Mono.justOrEmpty(match(feed, itemGuid, itemUrl)));
                });
    }

    static Optional<String> match(ParsedFeed feed, String itemGuid, String itemUrl) {
        Optional<FeedEntry> entry = feed.items().stream().filter(i -> itemGuid.equals(i.guid())).findFirst();
        if (entry.isEmpty() && itemUrl != null) {
            entry = feed.items().stream().filter(i -> itemUrl.equals(i.url())).findFirst();
        }
        return entry.map(e -> e.content() != null && !e.content().isBlank() ? e.content() : e.summary())
                .filter(text -> !text.isBlank());
    }

    private String cap(String content) {
        int max = feeds.getMaxCachedContentChars();
        return content.length() <= max ? content : content.substring(0, max);
    }
}
