package com.skyreader.sync.realtime.hub;

import java.time.Instant;

/**
 * In-memory index entry: a socket tagged with its identity and last liveness answer.
 */
final class ConnectionRecord {

    private final HubSocket socket;
    private final String did;
    private volatile Instant lastHeartbeat;

    ConnectionRecord(HubSocket socket, String did, Instant lastHeartbeat) {
        this.socket = socket;
        this.did = did;
        this.lastHeartbeat = lastHeartbeat;
    }

    HubSocket socket() {
        return socket;
    }

    String did() {
        return did;
    }

    Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    void heartbeat(Instant at) {
        this.lastHeartbeat = at;
    }

    ConnectionAttachment attachment() {
        return new ConnectionAttachment(did, lastHeartbeat);
    }
}
