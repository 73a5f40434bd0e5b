package com.skyreader.sync.core.notify;

import com.skyreader.sync.core.model.RealtimeMessage;

import reactor.core.publisher.Mono;

/**
 * Hands a notification to the realtime hub for fan-out.
 *
 * <p>Delivery is fire-and-forget from the caller's point of view: implementations log delivery problems and
 * complete normally, so hub unavailability never fails ingestion or feed refresh.</p>
 */
public interface RealtimeNotifier {

    Mono<Void> notify(RealtimeMessage message);
}
