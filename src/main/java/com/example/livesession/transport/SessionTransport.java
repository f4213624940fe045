package com.example.livesession.transport;

import com.example.livesession.exception.TransportUnavailableException;

/**
 * Delivery contract the engine relies on: named groups of connections and
 * fire-and-forget text frames. Implementations must be safe for concurrent use.
 */
public interface SessionTransport {

    void joinGroup(String connectionId, String group);

    void leaveGroup(String connectionId, String group);

    void leaveAllGroups(String connectionId);

    /** Direct send to one connection. */
    void send(String connectionId, String text) throws TransportUnavailableException;

    /** Sends to every member of the group; returns how many deliveries succeeded. */
    int broadcast(String group, String text);

    boolean isConnected(String connectionId);
}
