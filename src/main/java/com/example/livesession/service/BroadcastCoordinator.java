package com.example.livesession.service;

import com.example.livesession.event.EventType;
import com.example.livesession.event.SessionEvent;
import com.example.livesession.model.Session;
import com.example.livesession.transport.SessionTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fans session events out to the session's group. Presenter connections are additionally
 * members of a presenter group, which alone receives leaderboards when participants may not see them.
 *
 * <p>Called with the session lock held, so frames leave in production order.</p>
 */
@Component
public class BroadcastCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BroadcastCoordinator.class);

    private final SessionTransport transport;
    private final ObjectMapper objectMapper;

    public BroadcastCoordinator(SessionTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    public static String groupFor(String sessionId) {
        return "session:" + sessionId;
    }

    public static String presenterGroupFor(String sessionId) {
        return "session:" + sessionId + ":presenter";
    }

    /** Adds a connection to the session's groups. */
    public void attach(String connectionId, String sessionId, boolean presenter) {
        if (connectionId == null) return;
        transport.joinGroup(connectionId, groupFor(sessionId));
        if (presenter) transport.joinGroup(connectionId, presenterGroupFor(sessionId));
    }

    public void detach(String connectionId, String sessionId) {
        if (connectionId == null) return;
        transport.leaveGroup(connectionId, groupFor(sessionId));
        transport.leaveGroup(connectionId, presenterGroupFor(sessionId));
    }

    public void publish(Session session, SessionEvent event) {
        String json = toJson(event);
        if (json == null) return;

        String group = (event.type() == EventType.LEADERBOARD_UPDATED && !session.getSettings().isShowLeaderboard())
                ? presenterGroupFor(session.getId())
                : groupFor(session.getId());
        int delivered = transport.broadcast(group, json);
        log.debug("Broadcast session={} type={} seq={} delivered={}",
                session.getId(), event.type().wireName(), event.seq(), delivered);
    }

    /** Direct message to a single connection; failures propagate as TransportUnavailable. */
    public void sendTo(String connectionId, Object message) {
        String json = toJson(message);
        if (json != null) transport.send(connectionId, json);
    }

    String toJson(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {}", message.getClass().getSimpleName(), e);
            return null;
        }
    }
}
