package com.example.livesession.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Participants of one session, in join order.
 * The owning Session's lock guards every call, so this class adds no locking of its own.
 */
public class ParticipantRegistry {

    static final int MAX_NAME_LENGTH = 80;

    private final String sessionId;
    private final Map<String, Participant> byId = new LinkedHashMap<>();

    public ParticipantRegistry(String sessionId) {
        this.sessionId = sessionId;
    }

    /** Adds a new participant under a display name that is unique within the session. */
    public Participant add(String requestedName, Instant now) {
        String name = ensureUniqueName(requestedName);
        Participant p = new Participant(UUID.randomUUID().toString(), sessionId, name, now);
        byId.put(p.getId(), p);
        return p;
    }

    public Optional<Participant> find(String participantId) {
        if (participantId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(participantId));
    }

    public Participant remove(String participantId) {
        if (participantId == null) return null;
        return byId.remove(participantId);
    }

    public void clear() {
        byId.clear();
    }

    /** Snapshot list, join order preserved. */
    public List<Participant> all() {
        return new ArrayList<>(byId.values());
    }

    public List<Participant> connected() {
        List<Participant> out = new ArrayList<>();
        for (Participant p : byId.values()) {
            if (p.isConnected()) out.add(p);
        }
        return out;
    }

    public int size() {
        return byId.size();
    }

    public int connectedCount() {
        int n = 0;
        for (Participant p : byId.values()) {
            if (p.isConnected()) n++;
        }
        return n;
    }

    /** Case-insensitive check. */
    public boolean nameInUse(String raw) {
        String name = normalizeName(raw);
        for (Participant p : byId.values()) {
            if (p.getDisplayName().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    /**
     * Ensures a unique display name within this session.
     * - null/blank -> "Guest"
     * - Dedupes as "Name (2)", "Name (3)", ...
     */
    public String ensureUniqueName(String requested) {
        String base = normalizeName(requested);
        String candidate = base;
        int suffix = 2;
        while (nameInUse(candidate)) {
            candidate = base + " (" + suffix + ")";
            suffix++;
        }
        return candidate;
    }

    static String normalizeName(String s) {
        String t = (s == null) ? "" : s.trim();
        if (t.isEmpty()) t = "Guest";
        if (t.length() > MAX_NAME_LENGTH) t = t.substring(0, MAX_NAME_LENGTH);
        return t;
    }
}
