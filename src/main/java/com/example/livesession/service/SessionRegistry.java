package com.example.livesession.service;

import com.example.livesession.exception.NotFoundException;
import com.example.livesession.model.Session;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active sessions by id and by join code, plus the participant → session index.
 * The only structure shared between sessions.
 */
@Component
public class SessionRegistry {

    private final Map<String, Session> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByCode = new ConcurrentHashMap<>();
    private final Map<String, String> sessionByParticipant = new ConcurrentHashMap<>();

    /** Registers a new session; fails if its code is taken by another active session. */
    public void register(Session session) {
        String code = normalizeCode(session.getCode());
        String prev = idByCode.putIfAbsent(code, session.getId());
        if (prev != null && !prev.equals(session.getId())) {
            throw new IllegalStateException("Session code already in use: " + code);
        }
        byId.put(session.getId(), session);
    }

    public Optional<Session> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(sessionId));
    }

    public Session require(String sessionId) {
        return find(sessionId).orElseThrow(() -> NotFoundException.session(sessionId));
    }

    /** Case-insensitive. */
    public Optional<Session> findByCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String id = idByCode.get(normalizeCode(code));
        return id == null ? Optional.empty() : find(id);
    }

    public Session requireByCode(String code) {
        return findByCode(code).orElseThrow(() -> NotFoundException.session(code));
    }

    public boolean codeInUse(String code) {
        return code != null && idByCode.containsKey(normalizeCode(code));
    }

    // --- participant index ---

    public void bindParticipant(String participantId, String sessionId) {
        sessionByParticipant.put(participantId, sessionId);
    }

    public void unbindParticipant(String participantId) {
        if (participantId != null) sessionByParticipant.remove(participantId);
    }

    public Optional<Session> findByParticipant(String participantId) {
        if (participantId == null) return Optional.empty();
        String sid = sessionByParticipant.get(participantId);
        return sid == null ? Optional.empty() : find(sid);
    }

    public Session requireByParticipant(String participantId) {
        return findByParticipant(participantId).orElseThrow(() -> NotFoundException.participant(participantId));
    }

    /** Drops the session, its code and every participant bound to it. */
    public Session remove(String sessionId) {
        Session s = byId.remove(sessionId);
        if (s == null) return null;
        idByCode.remove(normalizeCode(s.getCode()), sessionId);
        sessionByParticipant.values().removeIf(sessionId::equals);
        return s;
    }

    public List<Session> all() {
        return new ArrayList<>(byId.values());
    }

    public int size() {
        return byId.size();
    }

    static String normalizeCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
