package com.skyreader.sync.feeds.parse;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;

/**
 * JSON form of a {@link ParsedFeed} as stored in {@code feed_cache.content}.
 *
 * <p>The payload never exceeds {@code maxCachedContentChars}: when the full feed is too large, only the first
 * half of the items is kept, and if that is still too large the items are dropped altogether.</p>
 */
@Component
public class FeedCacheCodec {

    private static final Logger log = LoggerFactory.getLogger(FeedCacheCodec.class);

    private final ObjectMapper mapper;
    private final int maxChars;

    public FeedCacheCodec(ObjectMapper mapper, FeedRefreshProperties props) {
        this(mapper, props.getMaxCachedContentChars());
    }

    FeedCacheCodec(ObjectMapper mapper, int maxChars) {
        this.mapper = mapper;
        this.maxChars = maxChars;
    }

    public String encode(ParsedFeed feed) {
        String full = write(feed);
        if (full.length() <= maxChars) {
            return full;
        }
        String half = write(feed.withItems(feed.items().subList(0, feed.items().size() / 2)));
        if (half.length() <= maxChars) {
            return half;
        }
        return write(feed.withItems(List.of()));
    }

    /**
     * @return the cached feed, or empty when the payload cannot be read (a warning is logged)
     */
    public Optional<ParsedFeed> decode(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(content, ParsedFeed.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached feed payload err={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String write(ParsedFeed feed) {
        try {
            return mapper.writeValueAsString(feed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Parsed feed is not serializable", e);
        }
    }
}
