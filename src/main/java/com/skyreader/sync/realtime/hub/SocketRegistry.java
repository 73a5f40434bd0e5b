package com.skyreader.sync.realtime.hub;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Open transport connections, independent of the hub's index. This is the part that outlives hibernation:
 * the hub rebuilds its index from these sockets and their attachments.
 */
@Component
public class SocketRegistry {

    private final Map<String, HubSocket> sockets = new ConcurrentHashMap<>();

    public void add(HubSocket socket) {
        sockets.put(socket.id(), socket);
    }

    public void remove(String id) {
        sockets.remove(id);
    }

    public Collection<HubSocket> open() {
        return List.copyOf(sockets.values()).stream().filter(HubSocket::isOpen).toList();
    }

    public int size() {
        return sockets.size();
    }
}
