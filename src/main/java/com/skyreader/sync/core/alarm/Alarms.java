package com.skyreader.sync.core.alarm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.store.StateStore;

import reactor.core.publisher.Mono;

/**
 * Persisted "next due" timestamps, one per alarm name, stored in {@code sync_state} as
 * {@code alarm:<name> = <epoch millis>}.
 *
 * <p>Because the due time is durable, scheduled work survives restarts: whichever process runs the
 * {@link AlarmDriver} next will pick it up.</p>
 */
@Component
public class Alarms {

    private static final Logger log = LoggerFactory.getLogger(Alarms.class);

    static final String KEY_PREFIX = "alarm:";

    private final StateStore state;
    private final Clock clock;

    public Alarms(StateStore state, Clock clock) {
        this.state = state;
        this.clock = clock;
    }

    public Mono<Void> set(String name, Instant dueAt) {
        return state.put(key(name), Long.toString(dueAt.toEpochMilli()));
    }

    public Mono<Void> setIn(String name, Duration delay) {
        return set(name, clock.instant().plus(delay));
    }

    /**
     * Sets the alarm only when none is pending.
     *
     * @return true if this call scheduled it
     */
    public Mono<Boolean> setIfAbsent(String name, Duration delay) {
        return get(name).hasElement().flatMap(pending -> pending
                ? Mono.just(false)
                : setIn(name, delay).thenReturn(true));
    }

    public Mono<Instant> get(String name) {
        return state.get(key(name)).flatMap(value -> {
            Long millis = parse(name, value);
            return millis == null ? Mono.empty() : Mono.just(Instant.ofEpochMilli(millis));
        });
    }

    public Mono<Void> clear(String name) {
        return state.delete(key(name));
    }

    /**
     * Takes ownership of a due alarm by moving its due time to {@code now + lease}, only if it still holds the
     * value we read. Two drivers racing on the same alarm cannot both win, and the alarm row is never removed
     * by a claim: a handler that dies or fails to reschedule fires again once the lease runs out.
     *
     * @return true when the alarm was due and this caller claimed it
     */
    Mono<Boolean> claimIfDue(String name, Instant now, Duration lease) {
        String key = key(name);
        return state.get(key).flatMap(value -> {
            Long millis = parse(name, value);
            if (millis == null) {
                // unreadable value: drop it so it cannot wedge the alarm forever
                return state.deleteIfValue(key, value).thenReturn(false);
            }
            if (millis > now.toEpochMilli()) {
                return Mono.just(false);
            }
            return state.replaceIfValue(key, value, Long.toString(now.plus(lease).toEpochMilli()));
        }).defaultIfEmpty(false);
    }

    private static String key(String name) {
        return KEY_PREFIX + name;
    }

    private static Long parse(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Unreadable alarm value name={} value={}", name, value);
            return null;
        }
    }
}
