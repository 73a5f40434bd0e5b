package com.skyreader.sync.jetstream.subscribe;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.web.util.UriComponentsBuilder;

import com.skyreader.sync.core.model.WatchedCollection;

/**
 * Firehose subscription URL.
 *
 * <pre>
 * &lt;endpoint&gt;?wantedCollections=&lt;nsid&gt;[&amp;wantedCollections=...][&amp;wantedDids=&lt;did&gt;...][&amp;cursor=&lt;time_us&gt;]
 * </pre>
 *
 * <p>At least one collection is required. {@code wantedDids} is deduplicated and capped; exceeding the cap is a
 * programming error, callers are expected to bound the set first.</p>
 */
public final class SubscribeUri {

    private static final Pattern DID = Pattern.compile("^did:[a-z]+:[A-Za-z0-9._:%-]+$");

    /** Upstream rejects larger filters. */
    public static final int MAX_WANTED_DIDS = 10_000;

    private final String endpoint;
    private final List<String> collections;
    private final List<String> wantedDids;
    private final Long cursor;

    private SubscribeUri(Builder b) {
        this.endpoint = requireEndpoint(b.endpoint);
        if (b.collections.isEmpty()) {
            throw new IllegalArgumentException("at least one collection is required");
        }
        if (b.wantedDids.size() > b.maxWantedDids) {
            throw new IllegalArgumentException(
                    "wantedDids has " + b.wantedDids.size() + " entries, limit is " + b.maxWantedDids);
        }
        if (b.cursor != null && b.cursor < 0) {
            throw new IllegalArgumentException("cursor must not be negative: " + b.cursor);
        }
        this.collections = List.copyOf(b.collections);
        this.wantedDids = List.copyOf(b.wantedDids);
        this.cursor = b.cursor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return true if {@code value} has the shape of a DID ({@code did:<method>:<id>})
     */
    public static boolean isDid(String value) {
        return value != null && DID.matcher(value).matches();
    }

    public URI toUri() {
        UriComponentsBuilder ub = UriComponentsBuilder.fromUriString(endpoint);
        for (String c : collections) {
            ub.queryParam("wantedCollections", c);
        }
        for (String d : wantedDids) {
            ub.queryParam("wantedDids", d);
        }
        if (cursor != null) {
            ub.queryParam("cursor", cursor);
        }
        return ub.encode().build().toUri();
    }

    public List<String> collections() {
        return collections;
    }

    public List<String> wantedDids() {
        return wantedDids;
    }

    public Long cursor() {
        return cursor;
    }

    @Override
    public String toString() {
        // never log the full DID list
        return endpoint + " collections=" + collections + " wantedDids=" + wantedDids.size() + " cursor=" + cursor;
    }

    private static String requireEndpoint(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (!(value.startsWith("ws://") || value.startsWith("wss://"))) {
            throw new IllegalArgumentException("endpoint must be a ws:// or wss:// url: " + value);
        }
        return value;
    }

    public static final class Builder {

        private String endpoint;
        private final Set<String> collections = new LinkedHashSet<>();
        private final Set<String> wantedDids = new LinkedHashSet<>();
        private int maxWantedDids = MAX_WANTED_DIDS;
        private Long cursor;

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder collection(WatchedCollection collection) {
            this.collections.add(Objects.requireNonNull(collection, "collection").nsid());
            return this;
        }

        public Builder collections(Collection<WatchedCollection> collections) {
            collections.forEach(this::collection);
            return this;
        }

        /**
         * Adds DIDs to the filter, skipping blanks and anything that is not a DID.
         */
        public Builder wantedDids(Collection<String> dids) {
            if (dids == null) {
                return this;
            }
            List<String> accepted = new ArrayList<>();
            for (String d : dids) {
                if (isDid(d)) {
                    accepted.add(d);
                }
            }
            this.wantedDids.addAll(accepted);
            return this;
        }

        public Builder maxWantedDids(int maxWantedDids) {
            this.maxWantedDids = Math.min(maxWantedDids, MAX_WANTED_DIDS);
            return this;
        }

        public Builder cursor(Long cursor) {
            this.cursor = cursor;
            return this;
        }

        public SubscribeUri build() {
            return new SubscribeUri(this);
        }
    }
}
