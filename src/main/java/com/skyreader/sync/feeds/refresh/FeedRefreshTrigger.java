package com.skyreader.sync.feeds.refresh;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;

import reactor.core.publisher.Mono;

/**
 * Periodic cycle trigger: every {@code triggerInterval} a new refresh cycle is requested. A cycle still in
 * progress is left alone.
 */
@Component
public class FeedRefreshTrigger implements AlarmHandler {

    private static final Logger log = LoggerFactory.getLogger(FeedRefreshTrigger.class);

    public static final String ALARM = "feed-refresh-trigger";

    private final FeedRefreshScheduler scheduler;
    private final Alarms alarms;
    private final FeedRefreshProperties props;

    public FeedRefreshTrigger(FeedRefreshScheduler scheduler, Alarms alarms, FeedRefreshProperties props) {
        this.scheduler = scheduler;
        this.alarms = alarms;
        this.props = props;
    }

    @Override
    public String alarmName() {
        return ALARM;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        if (!props.isAutoStart()) {
            return;
        }
        alarms.setIfAbsent(ALARM, Duration.ZERO).subscribe(
                scheduled -> log.info("Feed refresh trigger {}", scheduled ? "scheduled" : "already scheduled"),
                err -> log.warn("Could not schedule feed refresh trigger err={}", err.toString()));
    }

    @Override
    public Mono<Void> onAlarm() {
        return scheduler.trigger()
                .doOnNext(result -> log.info("Scheduled refresh trigger status={}", result.status()))
                .onErrorResume(err -> {
                    log.warn("Scheduled refresh trigger failed err={}", err.toString());
                    return Mono.empty();
                })
                .then(alarms.setIn(ALARM, props.getTriggerInterval()));
    }
}
