package com.example.livesession.event;

import com.example.livesession.model.Session;

import java.time.Instant;
import java.util.Objects;

/**
 * Envelope of every pushed event. {@code seq} is allocated from the session counter,
 * so it increases by one per event within a session.
 */
public record SessionEvent(EventType type, String sessionId, long seq, Instant emittedAt, Object payload) {

    public SessionEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(emittedAt, "emittedAt");
    }

    /** Allocates the next sequence number; caller must hold the session lock. */
    public static SessionEvent next(Session session, EventType type, Instant now, Object payload) {
        return new SessionEvent(type, session.getId(), session.nextSeq(), now, payload);
    }
}
