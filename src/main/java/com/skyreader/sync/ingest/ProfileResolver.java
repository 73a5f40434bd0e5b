package com.skyreader.sync.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyreader.sync.core.model.Profile;

import reactor.core.publisher.Mono;

/**
 * Public profile lookup through {@code app.bsky.actor.getProfile}.
 *
 * <p>Best effort: any failure (timeout, non-2xx, unexpected body) yields an empty Mono and a warning.</p>
 */
@Component
public class ProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

    private final WebClient http;
    private final EnrichmentProperties props;

    public ProfileResolver(WebClient.Builder builder, EnrichmentProperties props) {
        this.http = builder.build();
        this.props = props;
    }

    public Mono<Profile> resolve(String did) {
        String uri = UriComponentsBuilder.fromUriString(props.getProfileEndpoint())
                .queryParam("actor", did)
                .encode()
                .toUriString();

        return http.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(props.getProfileTimeout())
                .flatMap(body -> {
                    String resolvedDid = text(body, "did");
                    if (resolvedDid != null && !resolvedDid.equals(did)) {
                        log.warn("Profile lookup returned a different did requested={} got={}", did, resolvedDid);
                        return Mono.<Profile>empty();
                    }
                    return Mono.just(new Profile(did, text(body, "handle"), text(body, "displayName"),
                            text(body, "avatar")));
                })
                .onErrorResume(err -> {
                    log.warn("Profile lookup failed did={} err={}", did, err.toString());
                    return Mono.empty();
                });
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || !v.isTextual() || v.asText().isBlank() ? null : v.asText();
    }
}
