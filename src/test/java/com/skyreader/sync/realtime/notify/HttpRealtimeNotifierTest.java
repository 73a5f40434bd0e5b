package com.skyreader.sync.realtime.notify;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.support.StubExchange;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class HttpRealtimeNotifierTest {

    private final RealtimeMessage message = new RealtimeMessage("new_share", null);

    @Test
    void postsToHubBroadcastEndpoint() {
        StubExchange hub = StubExchange.respond(HttpStatus.OK, "{\"success\":true,\"delivered\":2}");
        HttpRealtimeNotifier notifier = new HttpRealtimeNotifier(hub.builder(), "http://hub.internal:8080/",
                Duration.ofSeconds(1));

        StepVerifier.create(notifier.notify(message)).verifyComplete();

        assertThat(hub.requests()).hasSize(1);
        assertThat(hub.requests().get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(hub.requests().get(0).url().toString()).isEqualTo("http://hub.internal:8080/realtime/broadcast");
    }

    @Test
    void hubErrorsNeverFailTheCaller() {
        StubExchange failing = StubExchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        StubExchange unreachable = new StubExchange(req -> Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(new HttpRealtimeNotifier(failing.builder(), "http://hub", Duration.ofSeconds(1))
                .notify(message)).verifyComplete();
        StepVerifier.create(new HttpRealtimeNotifier(unreachable.builder(), "http://hub", Duration.ofSeconds(1))
                .notify(message)).verifyComplete();
    }

    @Test
    void slowHubTimesOutQuietly() {
        StubExchange slow = new StubExchange(req -> Mono.never());

        StepVerifier.create(new HttpRealtimeNotifier(slow.builder(), "http://hub", Duration.ofMillis(50))
                .notify(message)).verifyComplete();
    }
}
