package com.skyreader.sync.ingest;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import com.skyreader.sync.core.model.Profile;
import com.skyreader.sync.support.StubExchange;

import reactor.test.StepVerifier;

class ProfileResolverTest {

    @Test
    void readsProfileFields() {
        StubExchange api = StubExchange.respond(HttpStatus.OK, "{\"did\":\"did:plc:a\",\"handle\":\"a.example\","
                + "\"displayName\":\"A\",\"avatar\":\"https://cdn.example/a.jpg\",\"followersCount\":3}");

        StepVerifier.create(new ProfileResolver(api.builder(), new EnrichmentProperties()).resolve("did:plc:a"))
                .expectNext(new Profile("did:plc:a", "a.example", "A", "https://cdn.example/a.jpg"))
                .verifyComplete();
    }

    @Test
    void mismatchedDidIsRejected() {
        StubExchange api = StubExchange.respond(HttpStatus.OK, "{\"did\":\"did:plc:other\",\"handle\":\"o\"}");

        StepVerifier.create(new ProfileResolver(api.builder(), new EnrichmentProperties()).resolve("did:plc:a"))
                .verifyComplete();
    }

    @Test
    void errorsBecomeEmpty() {
        StubExchange api = StubExchange.respond(HttpStatus.BAD_REQUEST, "{\"error\":\"InvalidRequest\"}");

        StepVerifier.create(new ProfileResolver(api.builder(), new EnrichmentProperties()).resolve("did:plc:a"))
                .verifyComplete();
    }
}
