package com.skyreader.sync.nats.bootstrap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.skyreader.sync.nats.config.KvBootstrapProperties;
import com.skyreader.sync.nats.config.KvBucketsProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.KeyValueStatus;
import io.nats.client.api.StorageType;

/**
 * Ensures the declared key-value buckets exist and match their specs.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>For each bucket: read its status; create it when missing.</li>
 *   <li>Existing buckets are compared on TTL, storage and replicas. Drift fails startup or is logged,
 *       depending on {@code skyreader.nats.bootstrap.fail-on-mismatch}. Buckets are never altered.</li>
 *   <li>Publish {@link KvBootstrapCompleteEvent}.</li>
 * </ol>
 *
 * <p>Permission and connectivity failures are not masked: only "not found" leads to creation.</p>
 */
@Component
@ConditionalOnProperty(prefix = "skyreader.nats.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KvBucketBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(KvBucketBootstrapper.class);

    /**
     * JetStream API error code for "stream not found". A KV bucket is backed by a stream named
     * {@code KV_<bucket>}, so a missing bucket reports this code.
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final KeyValueManagement kvm;
    private final KvBucketsProperties buckets;
    private final KvBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher publisher;

    public KvBucketBootstrapper(
            KeyValueManagement kvm,
            KvBucketsProperties buckets,
            KvBootstrapProperties bootstrapProps,
            ApplicationEventPublisher publisher
    ) {
        this.kvm = kvm;
        this.buckets = buckets;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> names = new ArrayList<>();
        for (KvBucketsProperties.BucketSpec spec : buckets.all()) {
            ensureBucket(spec);
            names.add(spec.getName());
        }

        publisher.publishEvent(new KvBootstrapCompleteEvent(List.copyOf(names)));
        log.info("KV bootstrap complete buckets={}", names);
    }

    private void ensureBucket(KvBucketsProperties.BucketSpec spec) throws Exception {
        KeyValueConfiguration desired = toBucketConfig(spec);

        try {
            KeyValueStatus existing = kvm.getStatus(desired.getBucketName());
            validateExisting(desired, existing.getConfiguration());
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        kvm.create(desired);
        log.info("Created KV bucket: {} (ttl={}, storage={}, replicas={})", desired.getBucketName(),
                desired.getTtl(), desired.getStorageType(), desired.getReplicas());
    }

    private void validateExisting(KeyValueConfiguration desired, KeyValueConfiguration actual) {
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getTtl(), desired.getTtl())) {
            diffs.add("ttl actual=" + actual.getTtl() + " expected=" + desired.getTtl());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }

        if (diffs.isEmpty()) {
            log.info("KV bucket exists and matches config: {}", desired.getBucketName());
            return;
        }

        String msg = "KV bucket exists but differs from expected: " + desired.getBucketName() + " :: "
                + String.join("; ", diffs);

        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    static KeyValueConfiguration toBucketConfig(KvBucketsProperties.BucketSpec spec) {
        if (spec.getName() == null || spec.getName().isBlank()) {
            throw new IllegalArgumentException("bucket name is required");
        }
        Duration ttl = Objects.requireNonNull(spec.getTtl(), "ttl is required for bucket " + spec.getName());

        return KeyValueConfiguration.builder()
                .name(spec.getName())
                .ttl(ttl)
                .storageType(parseStorageType(spec.getStorage()))
                .replicas(spec.getReplicas())
                .maxHistoryPerKey(1)
                .build();
    }

    private static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storage: " + value);
        };
    }
}
