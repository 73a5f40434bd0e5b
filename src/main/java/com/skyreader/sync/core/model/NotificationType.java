package com.skyreader.sync.core.model;

import java.util.Optional;

/**
 * Message types the hub understands. The wire name is the lower snake-case form.
 */
public enum NotificationType {
    CONNECTED("connected"),
    HEARTBEAT("heartbeat"),
    PONG("pong"),
    NEW_SHARE("new_share"),
    NEW_ARTICLES("new_articles"),
    FEED_READY("feed_ready");

    private final String wire;

    NotificationType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<NotificationType> fromWire(String value) {
        for (NotificationType t : values()) {
            if (t.wire.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
