package com.skyreader.sync.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.skyreader.sync.realtime.hub.HubSocket;

public class FakeHubSocket implements HubSocket {

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile String attachment;
    private volatile Integer closeCode;
    private volatile String closeReason;

    public FakeHubSocket(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean send(String text) {
        if (failSends || !open) {
            return false;
        }
        sent.add(text);
        return true;
    }

    @Override
    public void close(int code, String reason) {
        open = false;
        closeCode = code;
        closeReason = reason;
    }

    @Override
    public String attachment() {
        return attachment;
    }

    @Override
    public void attach(String attachment) {
        this.attachment = attachment;
    }

    public void failSends() {
        this.failSends = true;
    }

    public List<String> sent() {
        return List.copyOf(sent);
    }

    public List<String> sentOfType(String type) {
        return sent.stream().filter(s -> s.contains("\"type\":\"" + type + "\"")).toList();
    }

    public Integer closeCode() {
        return closeCode;
    }

    public String closeReason() {
        return closeReason;
    }
}
