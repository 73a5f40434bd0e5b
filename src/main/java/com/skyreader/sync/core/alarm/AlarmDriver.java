package com.skyreader.sync.core.alarm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Supervisor loop that fires due {@link AlarmHandler}s.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Every tick, each handler's alarm is checked and, when due, claimed by a compare-and-set that moves it
 *       {@code leaseWindow} ahead. If the handler never reschedules, the alarm fires again after that.</li>
 *   <li>The handler runs detached from the tick loop so a long job (a poll cycle) never delays other alarms.</li>
 *   <li>A handler is never run twice at the same time inside this process.</li>
 *   <li>Handler failures are logged; the loop keeps running.</li>
 * </ul>
 */
@Component
public class AlarmDriver implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(AlarmDriver.class);

    private final List<AlarmHandler> handlers;
    private final Alarms alarms;
    private final Clock clock;
    private final Duration tick;
    private final Duration leaseWindow;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public AlarmDriver(
            List<AlarmHandler> handlers,
            Alarms alarms,
            Clock clock,
            @Value("${skyreader.alarms.tick:1s}") Duration tick,
            @Value("${skyreader.alarms.lease-window:10m}") Duration leaseWindow
    ) {
        this.handlers = List.copyOf(handlers);
        this.alarms = alarms;
        this.clock = clock;
        this.tick = tick;
        this.leaseWindow = leaseWindow;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        if (running.get() != null) {
            return;
        }
        log.info("Alarm driver starting tick={} leaseWindow={} handlers={}", tick, leaseWindow,
                handlers.stream().map(AlarmHandler::alarmName).toList());

        Disposable d = Flux.interval(Duration.ZERO, tick)
                .onBackpressureDrop()
                .concatMap(t -> fireDue()
                        .onErrorResume(err -> {
                            log.warn("Alarm tick failed: {}", err.toString());
                            return Mono.empty();
                        }), 1)
                .subscribe(
                        v -> { },
                        err -> log.error("Alarm driver terminated unexpectedly: {}", err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    /**
     * Claims every due alarm and starts its handler. Completes once all claims are settled, not when the
     * handlers finish.
     */
    public Mono<Void> fireDue() {
        Instant now = clock.instant();
        return Flux.fromIterable(handlers)
                .flatMap(handler -> fireIfDue(handler, now))
                .then();
    }

    private Mono<Void> fireIfDue(AlarmHandler handler, Instant now) {
        String name = handler.alarmName();
        if (!inFlight.add(name)) {
            return Mono.empty();
        }
        return alarms.claimIfDue(name, now, leaseWindow)
                .doOnNext(claimed -> {
                    if (claimed) {
                        start(handler);
                    } else {
                        inFlight.remove(name);
                    }
                })
                .doOnError(err -> inFlight.remove(name))
                .then();
    }

    private void start(AlarmHandler handler) {
        String name = handler.alarmName();
        log.debug("Alarm fired name={}", name);
        Mono.defer(handler::onAlarm)
                .doFinally(sig -> inFlight.remove(name))
                .subscribe(
                        v -> { },
                        err -> log.warn("Alarm handler failed name={} err={}", name, err.toString(), err)
                );
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
