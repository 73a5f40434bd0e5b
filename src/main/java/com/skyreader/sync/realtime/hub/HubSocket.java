package com.skyreader.sync.realtime.hub;

/**
 * Transport-neutral view of one client connection.
 *
 * <p>The attachment is a small string kept with the transport connection itself. It survives the hub dropping
 * its in-memory index and is what the index is rebuilt from.</p>
 */
public interface HubSocket {

    /**
     * Stable handle of the connection.
     */
    String id();

    boolean isOpen();

    /**
     * Queues a text frame.
     *
     * @return false if the frame could not be queued; the connection should be treated as gone
     */
    boolean send(String text);

    void close(int code, String reason);

    String attachment();

    void attach(String attachment);
}
