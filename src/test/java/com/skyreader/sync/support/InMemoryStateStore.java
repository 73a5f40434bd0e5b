package com.skyreader.sync.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.skyreader.sync.core.store.StateStore;

import reactor.core.publisher.Mono;

public class InMemoryStateStore implements StateStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> values.get(key));
    }

    @Override
    public Mono<Void> put(String key, String value) {
        return Mono.fromRunnable(() -> values.put(key, value));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> values.remove(key));
    }

    @Override
    public Mono<Boolean> deleteIfValue(String key, String expected) {
        return Mono.fromSupplier(() -> values.remove(key, expected));
    }

    @Override
    public Mono<Boolean> replaceIfValue(String key, String expected, String value) {
        return Mono.fromSupplier(() -> values.replace(key, expected, value));
    }

    public String raw(String key) {
        return values.get(key);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }
}
