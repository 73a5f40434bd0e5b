package com.skyreader.sync.nats.kv;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.lease.InstanceLease;
import com.skyreader.sync.nats.config.KvBucketsProperties;

import io.nats.client.Connection;
import io.nats.client.KeyValue;
import io.nats.client.api.KeyValueEntry;
import io.nats.client.api.KeyValueOperation;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Active-instance marker in the coordination bucket. The bucket TTL is the freshness window: a holder that
 * stops refreshing simply disappears.
 */
@Component
public class NatsInstanceLease implements InstanceLease {

    private static final Logger log = LoggerFactory.getLogger(NatsInstanceLease.class);

    private final Connection connection;
    private final String bucket;

    private final AtomicReference<KeyValue> kv = new AtomicReference<>();

    public NatsInstanceLease(Connection connection, KvBucketsProperties buckets) {
        this.connection = connection;
        this.bucket = buckets.getCoordination().getName();
    }

    @Override
    public Mono<Void> claim(String instanceId) {
        return Mono.fromCallable(() -> {
                    long rev = bucket().put(KvKeys.ACTIVE_INSTANCE, instanceId);
                    log.debug("Lease claimed instance={} revision={}", instanceId, rev);
                    return rev;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<String> holder() {
        return Mono.fromCallable(() -> {
                    KeyValueEntry entry = bucket().get(KvKeys.ACTIVE_INSTANCE);
                    if (entry == null || entry.getOperation() != KeyValueOperation.PUT) {
                        return null;
                    }
                    return entry.getValueAsString();
                })
                .subscribeOn(Schedulers.boundedElastic());
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
