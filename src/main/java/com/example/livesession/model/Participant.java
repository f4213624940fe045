package com.example.livesession.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Participant of a live session. Score and statistics change only through
 * {@link #recordResponse(ParticipantResponse, boolean)}, so the score always equals the sum of accepted responses.
 * Session-level locking covers all mutation; see LiveSessionService.
 */
public class Participant {

    private final String id;
    private final String sessionId;
    private final String displayName;
    private final Instant joinedAt;

    private ConnectionState connectionState = ConnectionState.CONNECTED;
    /** Socket currently carrying this participant; null for REST-only participants. */
    private String connectionId;
    private volatile Instant lastSeenAt;

    private int score;
    private Instant firstCorrectAt;   // leaderboard tie-break
    private int answeredCount;
    private int correctCount;
    private long totalResponseMillis;

    public Participant(String id, String sessionId, String displayName, Instant joinedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
        this.lastSeenAt = joinedAt;
    }

    // identity
    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public String getDisplayName() { return displayName; }
    public Instant getJoinedAt() { return joinedAt; }

    // presence
    public ConnectionState getConnectionState() { return connectionState; }
    public boolean isConnected() { return connectionState == ConnectionState.CONNECTED; }
    public String getConnectionId() { return connectionId; }
    public void markConnected(Instant now, String connectionId) {
        this.connectionState = ConnectionState.CONNECTED;
        this.connectionId = connectionId;
        this.lastSeenAt = now;
    }
    public void markDisconnected(Instant now) {
        this.connectionState = ConnectionState.DISCONNECTED;
        this.connectionId = null;
        this.lastSeenAt = now;
    }
    public Instant getLastSeenAt() { return lastSeenAt; }
    public void bumpLastSeen(Instant now) { this.lastSeenAt = now; }

    // scoring
    public int getScore() { return score; }
    public Instant getFirstCorrectAt() { return firstCorrectAt; }
    public int getAnsweredCount() { return answeredCount; }
    public int getCorrectCount() { return correctCount; }
    public long getTotalResponseMillis() { return totalResponseMillis; }

    /**
     * @param scored false for unjudged answers (word cloud); those leave accuracy,
     *               response time and the tie-break untouched
     */
    public void recordResponse(ParticipantResponse response, boolean scored) {
        if (!id.equals(response.participantId())) {
            throw new IllegalArgumentException("Response " + response.participantId() + " does not belong to " + id);
        }
        score = Math.max(0, score + response.pointsAwarded());
        if (!scored) return;
        answeredCount++;
        totalResponseMillis += response.elapsedMillis();
        if (response.correct()) {
            correctCount++;
            if (firstCorrectAt == null) firstCorrectAt = response.receivedAt();
        }
    }

    /** Percentage of answered rounds that were correct, or null before the first answer. */
    public Double accuracy() {
        if (answeredCount == 0) return null;
        return Math.round(correctCount * 1000.0 / answeredCount) / 10.0;
    }

    /** Mean response time in seconds, or null before the first answer. */
    public Double averageResponseSeconds() {
        if (answeredCount == 0) return null;
        return Math.round((double) totalResponseMillis / answeredCount) / 1000.0;
    }

    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", score=" + score +
                ", connectionState=" + connectionState +
                ", answered=" + answeredCount +
                ", correct=" + correctCount +
                '}';
    }
}
