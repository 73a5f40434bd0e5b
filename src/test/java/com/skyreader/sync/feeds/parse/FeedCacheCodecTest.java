package com.skyreader.sync.feeds.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.support.Frames;

class FeedCacheCodecTest {

    private static ParsedFeed feed(int items, int bodyChars) {
        List<FeedEntry> entries = new ArrayList<>();
        for (int i = 0; i < items; i++) {
            entries.add(new FeedEntry("g" + i, null, "t" + i, null, null, "x".repeat(bodyChars), null, null));
        }
        return new ParsedFeed("Feed", "https://site.example/", null, entries);
    }

    @Test
    void smallFeedIsStoredWhole() {
        FeedCacheCodec codec = new FeedCacheCodec(Frames.MAPPER, 100_000);
        ParsedFeed feed = feed(4, 100);

        assertThat(codec.decode(codec.encode(feed))).contains(feed);
    }

    @Test
    void oversizedFeedKeepsFirstHalf() {
        FeedCacheCodec codec = new FeedCacheCodec(Frames.MAPPER, 3_000);

        String encoded = codec.encode(feed(10, 400));

        assertThat(encoded.length()).isLessThanOrEqualTo(3_000);
        assertThat(codec.decode(encoded).orElseThrow().items()).extracting(FeedEntry::guid)
                .containsExactly("g0", "g1", "g2", "g3", "g4");
    }

    @Test
    void hugeFeedDropsItems() {
        FeedCacheCodec codec = new FeedCacheCodec(Frames.MAPPER, 1_000);

        ParsedFeed decoded = codec.decode(codec.encode(feed(4, 2_000))).orElseThrow();

        assertThat(decoded.title()).isEqualTo("Feed");
        assertThat(decoded.items()).isEmpty();
    }

    @Test
    void unreadablePayloadDecodesToEmpty() {
        FeedCacheCodec codec = new FeedCacheCodec(Frames.MAPPER, 1_000);

        assertThat(codec.decode("{not json")).isEmpty();
        assertThat(codec.decode(null)).isEmpty();
    }
}
