package com.skyreader.sync.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.skyreader.sync.core.model.RealtimeMessage;
import com.skyreader.sync.core.notify.RealtimeNotifier;

import reactor.core.publisher.Mono;

public class RecordingNotifier implements RealtimeNotifier {

    private final List<RealtimeMessage> sent = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> notify(RealtimeMessage message) {
        return Mono.fromRunnable(() -> sent.add(message));
    }

    public List<RealtimeMessage> sent() {
        return List.copyOf(sent);
    }

    public List<RealtimeMessage> ofType(String type) {
        return sent.stream().filter(m -> m.type().equals(type)).toList();
    }
}
