package com.skyreader.sync.feeds.fetch;

import java.net.URI;
import java.util.OptionalLong;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.skyreader.sync.feeds.config.FeedRefreshProperties;

import reactor.core.publisher.Mono;

/**
 * Conditional GET of feed documents.
 *
 * <ul>
 *   <li>Sends {@code If-None-Match} / {@code If-Modified-Since} when validators are known.</li>
 *   <li>A {@code Content-Length} above {@code maxFeedBytes} is rejected before the body is read; a body that
 *       grows past it while buffering is rejected by the codec limit. Both yield {@link FetchResult#tooLarge()}.</li>
 *   <li>Non-2xx, timeouts and transport errors fail with {@link FeedFetchException}.</li>
 * </ul>
 */
@Component
public class FeedFetcher {

    private static final Logger log = LoggerFactory.getLogger(FeedFetcher.class);

    static final String ACCEPT_FEEDS = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";

    private final WebClient http;
    private final FeedRefreshProperties props;

    public FeedFetcher(WebClient.Builder builder, FeedRefreshProperties props) {
        this.props = props;
        this.http = builder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(props.getMaxFeedBytes()))
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, ACCEPT_FEEDS)
                .build();
    }

    /**
     * Unconditional fetch.
     */
    public Mono<FetchResult> fetch(String feedUrl) {
        return fetch(feedUrl, null, null);
    }

    public Mono<FetchResult> fetch(String feedUrl, String etag, String lastModified) {
        URI uri;
        try {
            uri = URI.create(feedUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(new FeedFetchException(feedUrl, "Invalid feed URL", e));
        }

        return http.get()
                .uri(uri)
                .headers(h -> {
                    if (etag != null && !etag.isBlank()) {
                        h.set(HttpHeaders.IF_NONE_MATCH, etag);
                    }
                    if (lastModified != null && !lastModified.isBlank()) {
                        h.set(HttpHeaders.IF_MODIFIED_SINCE, lastModified);
                    }
                })
                .exchangeToMono(response -> handle(feedUrl, response))
                .timeout(props.getFetchTimeout())
                .onErrorResume(DataBufferLimitException.class, e -> {
                    log.info("Feed body exceeded {} bytes url={}", props.getMaxFeedBytes(), feedUrl);
                    return Mono.just(FetchResult.tooLarge());
                })
                .onErrorMap(e -> !(e instanceof FeedFetchException), e -> new FeedFetchException(feedUrl,
                        e instanceof TimeoutException ? "Timeout" : e.toString(), e));
    }

    private Mono<FetchResult> handle(String feedUrl, ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.NOT_MODIFIED.value()) {
            return response.releaseBody().thenReturn(FetchResult.notModified());
        }
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody()
                    .then(Mono.error(new FeedFetchException(feedUrl, "HTTP " + status)));
        }

        OptionalLong declared = response.headers().contentLength();
        if (declared.isPresent() && declared.getAsLong() > props.getMaxFeedBytes()) {
            log.info("Feed declared {} bytes, above cap url={}", declared.getAsLong(), feedUrl);
            return response.releaseBody().thenReturn(FetchResult.tooLarge());
        }

        HttpHeaders headers = response.headers().asHttpHeaders();
        String etag = headers.getETag();
        String lastModified = headers.getFirst(HttpHeaders.LAST_MODIFIED);

        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> FetchResult.ok(body, etag, lastModified));
    }
}
