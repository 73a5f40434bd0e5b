package com.skyreader.sync.core.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.store.StateStore;

import reactor.core.publisher.Mono;

/**
 * {@link CursorStore} kept in {@code sync_state}, one row per stream id.
 */
@Component
public class StateCursorStore implements CursorStore {

    private static final Logger log = LoggerFactory.getLogger(StateCursorStore.class);

    private final StateStore state;

    public StateCursorStore(StateStore state) {
        this.state = state;
    }

    @Override
    public Mono<Long> get(String streamId) {
        return state.get(streamId).flatMap(value -> {
            try {
                return Mono.just(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable cursor streamId={} value={}", streamId, value);
                return Mono.empty();
            }
        });
    }

    @Override
    public Mono<Void> put(String streamId, long position) {
        return state.put(streamId, Long.toString(position));
    }
}
