package com.example.livesession.model;

import jakarta.persistence.*;

import java.time.Instant;

/** Archived results of an ended session. The full results are kept as JSON. */
@Entity
@Table(
    name = "session_results",
    indexes = {
        @Index(name = "idx_session_results_code", columnList = "code"),
        @Index(name = "idx_session_results_ended_at", columnList = "endedAt")
    }
)
public class SessionResultRecord {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String sessionId;

    @Column(nullable = false, length = 16)
    private String code;

    @Column(length = 200)
    private String name;

    private Instant startedAt;

    private Instant endedAt;

    private Long durationSeconds;

    @Column(nullable = false)
    private int totalParticipants;

    @Column(nullable = false)
    private int questionsAsked;

    @Column(nullable = false)
    private double averageScore;

    @Column(nullable = false)
    private double completionRate;

    @Lob
    @Column(nullable = false)
    private String resultsJson;

    @Column(nullable = false)
    private Instant archivedAt;

    protected SessionResultRecord() {}

    public SessionResultRecord(String sessionId, String code) {
        this.sessionId = sessionId;
        this.code = code;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        if (this.archivedAt == null) this.archivedAt = Instant.now();
    }

    public String getSessionId() { return sessionId; }
    public String getCode() { return code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public Long getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Long durationSeconds) { this.durationSeconds = durationSeconds; }

    public int getTotalParticipants() { return totalParticipants; }
    public void setTotalParticipants(int totalParticipants) { this.totalParticipants = totalParticipants; }

    public int getQuestionsAsked() { return questionsAsked; }
    public void setQuestionsAsked(int questionsAsked) { this.questionsAsked = questionsAsked; }

    public double getAverageScore() { return averageScore; }
    public void setAverageScore(double averageScore) { this.averageScore = averageScore; }

    public double getCompletionRate() { return completionRate; }
    public void setCompletionRate(double completionRate) { this.completionRate = completionRate; }

    public String getResultsJson() { return resultsJson; }
    public void setResultsJson(String resultsJson) { this.resultsJson = resultsJson; }

    public Instant getArchivedAt() { return archivedAt; }
}
