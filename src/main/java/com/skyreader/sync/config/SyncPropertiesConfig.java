package com.skyreader.sync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.skyreader.sync.feeds.config.FeedRefreshProperties;
import com.skyreader.sync.ingest.EnrichmentProperties;
import com.skyreader.sync.jetstream.config.JetstreamProperties;
import com.skyreader.sync.realtime.config.RealtimeProperties;

/**
 * Binds the non-NATS configuration groups. NATS settings are bound by {@code NatsConfig}.
 */
@Configuration
@EnableConfigurationProperties({
        JetstreamProperties.class,   // firehose endpoint, poller and live consumer
        FeedRefreshProperties.class, // scheduled refresh budgets
        RealtimeProperties.class,    // hub heartbeat / hibernation
        EnrichmentProperties.class   // profile and article lookups
})
public class SyncPropertiesConfig {
}
