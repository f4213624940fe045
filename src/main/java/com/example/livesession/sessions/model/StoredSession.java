package com.example.livesession.sessions.model;

import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.model.SessionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Storage-agnostic snapshot of a live session's state, produced by SessionCodec.
 * Questions and responses are stored separately through SessionStore.
 */
public class StoredSession {

    // --- Identity ----------------------------------------------------------

    private String id;
    private String code;
    private String name;
    private String presenterId;
    private String presenterKeyHash;

    // --- State -------------------------------------------------------------

    private SessionStatus status;
    private SessionSettings settings = SessionSettings.defaults();
    private List<String> questionIds = new ArrayList<>();
    private int currentIndex = -1;
    private String currentRoundId;
    private long seq;

    private Instant createdAt;
    private Instant startedAt;
    private Instant endedAt;
    private Instant updatedAt;

    private List<StoredParticipant> participants = new ArrayList<>();
    private List<StoredRound> rounds = new ArrayList<>();
    private List<LeaderboardEntry> finalLeaderboard = new ArrayList<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = Objects.requireNonNull(id, "id"); }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPresenterId() { return presenterId; }
    public void setPresenterId(String presenterId) { this.presenterId = presenterId; }

    public String getPresenterKeyHash() { return presenterKeyHash; }
    public void setPresenterKeyHash(String presenterKeyHash) { this.presenterKeyHash = presenterKeyHash; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public SessionSettings getSettings() { return settings; }
    public void setSettings(SessionSettings settings) {
        this.settings = (settings == null) ? SessionSettings.defaults() : settings;
    }

    public List<String> getQuestionIds() { return questionIds; }
    public void setQuestionIds(List<String> questionIds) {
        this.questionIds = (questionIds == null) ? new ArrayList<>() : new ArrayList<>(questionIds);
    }

    public int getCurrentIndex() { return currentIndex; }
    public void setCurrentIndex(int currentIndex) { this.currentIndex = currentIndex; }

    public String getCurrentRoundId() { return currentRoundId; }
    public void setCurrentRoundId(String currentRoundId) { this.currentRoundId = currentRoundId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public List<StoredParticipant> getParticipants() { return participants; }
    public void setParticipants(List<StoredParticipant> participants) {
        this.participants = (participants == null) ? new ArrayList<>() : new ArrayList<>(participants);
    }

    public List<StoredRound> getRounds() { return rounds; }
    public void setRounds(List<StoredRound> rounds) {
        this.rounds = (rounds == null) ? new ArrayList<>() : new ArrayList<>(rounds);
    }

    public List<LeaderboardEntry> getFinalLeaderboard() { return finalLeaderboard; }
    public void setFinalLeaderboard(List<LeaderboardEntry> finalLeaderboard) {
        this.finalLeaderboard = (finalLeaderboard == null) ? new ArrayList<>() : new ArrayList<>(finalLeaderboard);
    }
}
