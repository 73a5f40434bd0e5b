package com.skyreader.sync.realtime.hub;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.skyreader.sync.support.Frames;

class ConnectionAttachmentTest {

    @Test
    void encodesVersionedShape() {
        String raw = new ConnectionAttachment("did:plc:a", Instant.ofEpochMilli(1_700_000_000_000L)).encode(Frames.MAPPER);

        assertThat(raw).isEqualTo("{\"v\":1,\"did\":\"did:plc:a\",\"lastHeartbeat\":1700000000000}");
    }

    @Test
    void toleratesAddedFields() {
        assertThat(ConnectionAttachment.decode(Frames.MAPPER,
                "{\"v\":1,\"did\":\"did:plc:a\",\"lastHeartbeat\":5,\"region\":\"eu\"}"))
                .contains(new ConnectionAttachment("did:plc:a", Instant.ofEpochMilli(5)));
    }

    @Test
    void rejectsUnknownVersionsAndBrokenInput() {
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, null)).isEmpty();
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, "{")).isEmpty();
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, "{\"v\":2,\"did\":\"did:plc:a\",\"lastHeartbeat\":5}"))
                .isEmpty();
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, "{\"v\":1,\"lastHeartbeat\":5}")).isEmpty();
        assertThat(ConnectionAttachment.decode(Frames.MAPPER, "{\"v\":1,\"did\":\"did:plc:a\"}")).isEmpty();
    }
}
