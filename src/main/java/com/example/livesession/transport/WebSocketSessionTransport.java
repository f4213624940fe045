package com.example.livesession.transport;

import com.example.livesession.exception.TransportUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionTransport} over Spring WebSocket sessions. Each connection is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator} so timer threads and request threads can send
 * concurrently; a slow client overflowing its buffer is closed and dropped.
 */
@Component
public class WebSocketSessionTransport implements SessionTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionTransport.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();

    public void register(WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
        connections.put(session.getId(), safe);
    }

    public void unregister(String connectionId) {
        leaveAllGroups(connectionId);
        connections.remove(connectionId);
    }

    @Override
    public void joinGroup(String connectionId, String group) {
        groups.computeIfAbsent(group, g -> ConcurrentHashMap.newKeySet()).add(connectionId);
    }

    @Override
    public void leaveGroup(String connectionId, String group) {
        Set<String> members = groups.get(group);
        if (members == null) return;
        members.remove(connectionId);
        if (members.isEmpty()) groups.remove(group, members);
    }

    @Override
    public void leaveAllGroups(String connectionId) {
        for (String group : List.copyOf(groups.keySet())) {
            leaveGroup(connectionId, group);
        }
    }

    @Override
    public void send(String connectionId, String text) {
        WebSocketSession ws = connections.get(connectionId);
        if (ws == null || !ws.isOpen()) {
            drop(connectionId);
            throw new TransportUnavailableException(connectionId, null);
        }
        try {
            ws.sendMessage(new TextMessage(text));
        } catch (Exception e) {
            log.warn("WS send failed conn={}: {}", connectionId, e.toString());
            drop(connectionId);
            throw new TransportUnavailableException(connectionId, e);
        }
    }

    @Override
    public int broadcast(String group, String text) {
        Set<String> members = groups.get(group);
        if (members == null || members.isEmpty()) return 0;
        int delivered = 0;
        for (String id : List.copyOf(members)) {
            try {
                send(id, text);
                delivered++;
            } catch (TransportUnavailableException e) {
                log.warn("Dropped connection {} from group {}", id, group);
            }
        }
        return delivered;
    }

    @Override
    public boolean isConnected(String connectionId) {
        WebSocketSession ws = connections.get(connectionId);
        return ws != null && ws.isOpen();
    }

    public int connectionCount() {
        return connections.size();
    }

    private void drop(String connectionId) {
        WebSocketSession ws = connections.remove(connectionId);
        leaveAllGroups(connectionId);
        if (ws != null && ws.isOpen()) {
            try {
                ws.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (Exception e) {
                log.debug("WS close after failure conn={}: {}", connectionId, e.toString());
            }
        }
    }
}
