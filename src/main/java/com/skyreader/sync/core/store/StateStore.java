package com.skyreader.sync.core.store;

import reactor.core.publisher.Mono;

/**
 * Small durable key/value table ({@code sync_state}) for cursors, alarms, statistics and cycle state.
 *
 * <p>Keys are independent; no operation spans more than one key.</p>
 */
public interface StateStore {

    /**
     * @return the stored value, or an empty Mono when the key is absent
     */
    Mono<String> get(String key);

    /**
     * Inserts or overwrites the value of {@code key}.
     */
    Mono<Void> put(String key, String value);

    Mono<Void> delete(String key);

    /**
     * Deletes {@code key} only if it still holds {@code expected}.
     *
     * @return true when this call removed the row
     */
    Mono<Boolean> deleteIfValue(String key, String expected);

    /**
     * Overwrites {@code key} with {@code value} only if it still holds {@code expected}.
     *
     * @return true when this call replaced the value
     */
    Mono<Boolean> replaceIfValue(String key, String expected, String value);
}
