package com.example.livesession.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a live session.
 * <pre>
 *   Pending → Running → {Paused ↔ Running} → Ended
 *   Pending → Ended (cancelled before start)
 * </pre>
 * Ended is terminal.
 */
public enum SessionStatus {

    PENDING("Pending"),
    RUNNING("Running"),
    PAUSED("Paused"),
    ENDED("Ended");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == ENDED;
    }

    /** Statuses reachable from this one in a single step. */
    public Set<SessionStatus> successors() {
        switch (this) {
            case PENDING: return EnumSet.of(RUNNING, ENDED);
            case RUNNING: return EnumSet.of(PAUSED, ENDED);
            case PAUSED:  return EnumSet.of(RUNNING, ENDED);
            default:      return EnumSet.noneOf(SessionStatus.class);
        }
    }

    public boolean canTransitionTo(SessionStatus target) {
        return target != null && successors().contains(target);
    }

    @JsonCreator
    public static SessionStatus fromWire(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "WAITING":     return PENDING;
            case "IN_PROGRESS": return RUNNING;
            case "COMPLETED":
            case "CANCELLED":   return ENDED;
            default:            return SessionStatus.valueOf(s);
        }
    }
}
