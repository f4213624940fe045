package com.example.livesession.sessions.model;

import java.time.Instant;

/** Participant row of a stored session snapshot. */
public class StoredParticipant {

    private String id;
    private String displayName;
    private int score;
    private boolean connected;
    private Instant joinedAt;
    private Instant firstCorrectAt;
    private int answeredCount;
    private int correctCount;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public int getScore() { return score; }
    public void setScore(int score) { this.score = score; }

    public boolean isConnected() { return connected; }
    public void setConnected(boolean connected) { this.connected = connected; }

    public Instant getJoinedAt() { return joinedAt; }
    public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }

    public Instant getFirstCorrectAt() { return firstCorrectAt; }
    public void setFirstCorrectAt(Instant firstCorrectAt) { this.firstCorrectAt = firstCorrectAt; }

    public int getAnsweredCount() { return answeredCount; }
    public void setAnsweredCount(int answeredCount) { this.answeredCount = answeredCount; }

    public int getCorrectCount() { return correctCount; }
    public void setCorrectCount(int correctCount) { this.correctCount = correctCount; }
}
