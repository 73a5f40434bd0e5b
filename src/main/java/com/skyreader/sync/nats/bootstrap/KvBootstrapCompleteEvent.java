package com.skyreader.sync.nats.bootstrap;

import java.util.List;

/**
 * Published once all declared key-value buckets exist. Components that use the buckets at startup (the live
 * consumer claiming its lease) listen for it.
 *
 * @param buckets names of the buckets that were verified or created
 */
public record KvBootstrapCompleteEvent(List<String> buckets) {
}
