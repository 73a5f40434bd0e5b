package com.skyreader.sync.nats.kv;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.model.UserSession;
import com.skyreader.sync.core.session.SessionResolver;
import com.skyreader.sync.nats.config.KvBucketsProperties;

import io.nats.client.Connection;
import io.nats.client.KeyValue;
import io.nats.client.api.KeyValueEntry;
import io.nats.client.api.KeyValueOperation;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Resolves session tokens against the sessions bucket. Entries are JSON documents written by the API tier
 * at sign-in; only {@code did} is read. Expiry is the bucket TTL.
 */
@Component
public class NatsSessionResolver implements SessionResolver {

    private static final Logger log = LoggerFactory.getLogger(NatsSessionResolver.class);

    private final Connection connection;
    private final String bucket;
    private final ObjectMapper mapper;

    private final AtomicReference<KeyValue> kv = new AtomicReference<>();

    public NatsSessionResolver(Connection connection, KvBucketsProperties buckets, ObjectMapper mapper) {
        this.connection = connection;
        this.bucket = buckets.getSessions().getName();
        this.mapper = mapper;
    }

    @Override
    public Mono<UserSession> resolve(String token) {
        String key = KvKeys.session(token);
        if (key == null) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                    KeyValueEntry entry = bucket().get(key);
                    if (entry == null || entry.getOperation() != KeyValueOperation.PUT || entry.getValue() == null) {
                        return null;
                    }
                    JsonNode doc = mapper.readTree(entry.getValue());
                    String did = doc.path("did").asText(null);
                    return did == null || did.isBlank() ? null : new UserSession(did);
                })
                // KV get is a blocking request/reply
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(err -> {
                    log.warn("Session lookup failed bucket={} err={}", bucket, err.toString());
                    return Mono.empty();
                });
    }

    private KeyValue bucket() throws Exception {
        KeyValue current = kv.get();
        if (current == null) {
            current = connection.keyValue(bucket);
            kv.compareAndSet(null, current);
        }
        return current;
    }
}
