package com.skyreader.sync.core.alarm;

import reactor.core.publisher.Mono;

/**
 * Work triggered by a durable alarm.
 *
 * <p>Before calling {@link #onAlarm()} the driver pushes the alarm forward by its lease window, so a handler
 * that never finishes is fired again later. A handler sets its next due time through {@link Alarms}, normally as
 * the last step of its work, and calls {@link Alarms#clear(String)} when it does not want to run again.</p>
 */
public interface AlarmHandler {

    /**
     * Stable alarm name; also the storage key suffix.
     */
    String alarmName();

    Mono<Void> onAlarm();
}
