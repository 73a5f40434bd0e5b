package com.skyreader.sync.realtime.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.notify.RealtimeNotifier;
import com.skyreader.sync.realtime.hub.RealtimeHub;

import reactor.core.publisher.Mono;

/**
 * Delivers straight to the hub running in this process.
 */
public class InProcessRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(InProcessRealtimeNotifier.class);

    private final RealtimeHub hub;

    public InProcessRealtimeNotifier(RealtimeHub hub) {
        this.hub = hub;
    }

    @Override
    public Mono<Void> notify(RealtimeMessage message) {
        return hub.broadcast(message)
                .doOnNext(delivered -> log.debug("Realtime message delivered type={} connections={}",
                        message.type(), delivered))
                .onErrorResume(err -> {
                    log.warn("Realtime broadcast failed type={} err={}", message.type(), err.toString());
                    return Mono.empty();
                })
                .then();
    }
}
