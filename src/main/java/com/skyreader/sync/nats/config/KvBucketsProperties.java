package com.skyreader.sync.nats.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Declarative definitions of the key-value buckets this service relies on.
 *
 * <ul>
 *   <li><b>sessions</b>: written by the API tier at sign-in, read by the realtime hub at upgrade time.
 *       Entry TTL bounds session lifetime.</li>
 *   <li><b>coordination</b>: holds the active-instance marker of the live firehose consumer. The TTL is the
 *       marker's freshness window.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "skyreader.nats.buckets")
public class KvBucketsProperties {

    private BucketSpec sessions = BucketSpec.of("skyreader-sessions", Duration.ofDays(30));

    private BucketSpec coordination = BucketSpec.of("skyreader-coordination", Duration.ofHours(24));

    public BucketSpec getSessions() { return sessions; }
    public void setSessions(BucketSpec sessions) { this.sessions = sessions; }

    public BucketSpec getCoordination() { return coordination; }
    public void setCoordination(BucketSpec coordination) { this.coordination = coordination; }

    public List<BucketSpec> all() {
        return List.of(sessions, coordination);
    }

    public static class BucketSpec {

        private String name;

        /** Per-entry expiry. */
        private Duration ttl;

        /** {@code file} or {@code memory}. */
        private String storage = "file";

        private int replicas = 1;

        public static BucketSpec of(String name, Duration ttl) {
            BucketSpec s = new BucketSpec();
            s.name = name;
            s.ttl = ttl;
            return s;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public String getStorage() { return storage; }
        public void setStorage(String storage) { this.storage = storage; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }
    }
}
