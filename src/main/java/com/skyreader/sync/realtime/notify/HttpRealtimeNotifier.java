package com.skyreader.sync.realtime.notify;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.notify.RealtimeNotifier;

import reactor.core.publisher.Mono;

/**
 * Posts notifications to a hub running elsewhere ({@code POST <hubUrl>/realtime/broadcast}).
 */
public class HttpRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(HttpRealtimeNotifier.class);

    static final String BROADCAST_PATH = "/realtime/broadcast";

    private final WebClient http;
    private final Duration timeout;

    public HttpRealtimeNotifier(WebClient.Builder builder, String hubUrl, Duration timeout) {
        this.http = builder.baseUrl(stripTrailingSlash(hubUrl)).build();
        this.timeout = timeout;
    }

    @Override
    public Mono<Void> notify(RealtimeMessage message) {
        return http.post()
                .uri(BROADCAST_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(message)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .then()
                .onErrorResume(err -> {
                    log.warn("Realtime notify failed type={} err={}", message.type(), err.toString());
                    return Mono.empty();
                });
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
