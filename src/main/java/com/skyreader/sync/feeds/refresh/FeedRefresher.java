package com.skyreader.sync.feeds.refresh;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyreader.sync.core.model.CachedFeed;
import com.skyreader.sync.core.model.ItemStoreResult;
import com.skyreader.sync.core.model.NotificationType;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.model.RefreshCandidate;
import com.skyreader.sync.core.notify.RealtimeNotifier;
import com.skyreader.sync.core.store.FeedCacheStore;
import com.skyreader.sync.core.store.FeedItemStore;
import com.skyreader.sync.core.store.FeedMetadataStore;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;
import com.skyreader.sync.feeds.fetch.FeedFetchException;
import com.skyreader.sync.feeds.fetch.FeedFetcher;
import com.skyreader.sync.feeds.fetch.FetchResult;
import com.skyreader.sync.feeds.parse.FeedCacheCodec;
import com.skyreader.sync.feeds.parse.FeedParseException;
import com.skyreader.sync.feeds.parse.FeedParser;

import reactor.core.publisher.Mono;

/**
 * Refreshes a single feed.
 *
 * <ul>
 *   <li>error count at or above the budget: skipped without any request</li>
 *   <li>304: only {@code last_scheduled_fetch_at}, subscriber count and cache freshness are updated</li>
 *   <li>too large: error recorded as "Feed too large", counted as skipped</li>
 *   <li>non-2xx, transport or parse failure: error recorded, counted as failed</li>
 *   <li>success: items stored, cache and metadata rewritten, {@code new_articles} / {@code feed_ready} sent</li>
 * </ul>
 */
@Component
public class FeedRefresher {

    private static final Logger log = LoggerFactory.getLogger(FeedRefresher.class);

    private final FeedFetcher fetcher;
    private final FeedParser parser;
    private final FeedCacheCodec codec;
    private final FeedMetadataStore metadata;
    private final FeedCacheStore cache;
    private final FeedItemStore items;
    private final RealtimeNotifier notifier;
    private final FeedRefreshProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FeedRefresher(FeedFetcher fetcher, FeedParser parser, FeedCacheCodec codec, FeedMetadataStore metadata,
            FeedCacheStore cache, FeedItemStore items, RealtimeNotifier notifier, FeedRefreshProperties props,
            ObjectMapper mapper, Clock clock) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.codec = codec;
        this.metadata = metadata;
        this.cache = cache;
        this.items = items;
        this.notifier = notifier;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Mono<RefreshOutcome> refresh(RefreshCandidate candidate) {
        String url = candidate.feedUrl();
        if (candidate.errorCount() >= props.getMaxErrorCount()) {
            log.info("Skipping feed with too many errors url={} errors={}", url, candidate.errorCount());
            return Mono.just(RefreshOutcome.SKIPPED);
        }

        Instant now = clock.instant();
        return fetcher.fetch(url, candidate.etag(), candidate.lastModified())
                .flatMap(result -> switch (result.status()) {
                    case NOT_MODIFIED -> metadata.recordNotModified(url, candidate.subscriberCount(), now)
                            .then(cache.touch(url, now))
                            .thenReturn(RefreshOutcome.NOT_MODIFIED);
                    case TOO_LARGE -> metadata.recordError(url, "Feed too large", now)
                            .thenReturn(RefreshOutcome.SKIPPED);
                    case OK -> store(candidate, result, now);
                })
                .onErrorResume(FeedFetchException.class, e -> {
                    log.warn("Feed fetch failed url={} err={}", url, e.getMessage());
                    return metadata.recordError(url, e.getMessage(), now).thenReturn(RefreshOutcome.FAILED);
                });
    }

    private Mono<RefreshOutcome> store(RefreshCandidate candidate, FetchResult result, Instant now) {
        String url = candidate.feedUrl();
        ParsedFeed feed;
        try {
            feed = parser.parse(result.body(), url);
        } catch (FeedParseException e) {
            log.warn("Feed parse failed url={} err={}", url, e.getMessage());
            return metadata.recordError(url, e.getMessage(), now).thenReturn(RefreshOutcome.FAILED);
        }

        CachedFeed cached = new CachedFeed(url, codec.encode(feed), result.etag(), result.lastModified(), now);
        return items.storeItems(url, feed.items(), now)
                .flatMap(stored -> cache.put(cached)
                        .then(metadata.recordSuccess(url, feed, result.etag(), result.lastModified(),
                                candidate.subscriberCount(), now))
                        .then(Mono.fromRunnable(() -> announce(url, feed, stored)))
                        .doOnSuccess(v -> log.info("Feed refreshed url={} items={} new={}", url,
                                feed.items().size(), stored.newCount()))
                        .thenReturn(RefreshOutcome.FETCHED));
    }

    private void announce(String url, ParsedFeed feed, ItemStoreResult stored) {
        if (stored.newCount() > 0) {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("feedUrl", url);
            payload.put("feedTitle", feed.title());
            payload.put("newCount", stored.newCount());
            payload.put("timestamp", clock.millis());
            send(RealtimeMessage.of(NotificationType.NEW_ARTICLES, payload), url);
        }
        if (stored.initialImport()) {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("feedUrl", url);
            payload.put("feedTitle", feed.title());
            payload.put("itemCount", feed.items().size());
            payload.put("timestamp", clock.millis());
            send(RealtimeMessage.of(NotificationType.FEED_READY, payload), url);
        }
    }

    private void send(RealtimeMessage message, String url) {
        notifier.notify(message).subscribe(v -> { }, err -> log.warn("{} notify failed url={} err={}",
                message.type(), url, err.toString()));
    }
}
