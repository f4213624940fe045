package com.example.livesession.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Activation window of one question inside a session.
 *
 * <p>Timing is kept as absolute instants: the deadline is
 * {@code activatedAt + timeLimit + extensions + time spent paused}. Clients receive the same
 * instants and compute the countdown locally.</p>
 *
 * <p>Not thread-safe; guarded by the owning session's lock.</p>
 */
public class QuestionRound {

    private final String id;
    private final String sessionId;
    private final Question question;
    private final int index;              // 0-based position in the session's question list
    private final Instant activatedAt;

    private long extensionMillis;
    private long pausedMillis;
    private Instant pausedAt;

    private boolean closed;
    private CloseReason closeReason;
    private Instant closedAt;

    /** participantId → response, in server receipt order. */
    private final Map<String, ParticipantResponse> responses = new LinkedHashMap<>();

    public QuestionRound(String id, String sessionId, Question question, int index, Instant activatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.question = Objects.requireNonNull(question, "question");
        this.index = index;
        this.activatedAt = Objects.requireNonNull(activatedAt, "activatedAt");
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public Question getQuestion() { return question; }
    public String getQuestionId() { return question.id(); }
    public QuestionType getType() { return question.type(); }
    public int getPointValue() { return question.points(); }
    public int getTimeLimitSeconds() { return question.timeLimitSeconds(); }
    public int getIndex() { return index; }
    public Instant getActivatedAt() { return activatedAt; }
    public long getExtensionMillis() { return extensionMillis; }

    // ---------------------------------------------------------------------
    // Timing
    // ---------------------------------------------------------------------

    /** Time limit including presenter extensions. */
    public long effectiveLimitMillis() {
        return question.timeLimitSeconds() * 1000L + extensionMillis;
    }

    public Instant deadline() {
        return activatedAt.plusMillis(effectiveLimitMillis() + pausedMillis);
    }

    public boolean isPaused() {
        return pausedAt != null;
    }

    /** Milliseconds of answering time consumed at {@code now}, excluding pauses. */
    public long elapsedMillis(Instant now) {
        long raw = now.toEpochMilli() - activatedAt.toEpochMilli() - pausedMillis;
        if (pausedAt != null) {
            raw -= Math.max(0L, now.toEpochMilli() - pausedAt.toEpochMilli());
        }
        return Math.max(0L, raw);
    }

    public long remainingMillis(Instant now) {
        if (closed) return 0L;
        return Math.max(0L, effectiveLimitMillis() - elapsedMillis(now));
    }

    /** True once the answering time is used up; a response at exactly the limit still counts. */
    public boolean isExpired(Instant now) {
        return !closed && elapsedMillis(now) > effectiveLimitMillis();
    }

    public void pause(Instant now) {
        if (pausedAt == null && !closed) pausedAt = now;
    }

    /** Ends a pause; the deadline moves by the paused duration. */
    public void resume(Instant now) {
        if (pausedAt == null) return;
        pausedMillis += Math.max(0L, now.toEpochMilli() - pausedAt.toEpochMilli());
        pausedAt = null;
    }

    public void extend(long millis) {
        if (millis > 0) extensionMillis += millis;
    }

    // ---------------------------------------------------------------------
    // Closing
    // ---------------------------------------------------------------------

    public boolean isClosed() { return closed; }
    public boolean isOpen() { return !closed; }
    public CloseReason getCloseReason() { return closeReason; }
    public Instant getClosedAt() { return closedAt; }

    /** Returns false if the round was already closed; the first reason wins. */
    public boolean close(CloseReason reason, Instant now) {
        if (closed) return false;
        if (pausedAt != null) resume(now);
        closed = true;
        closeReason = reason;
        closedAt = now;
        return true;
    }

    // ---------------------------------------------------------------------
    // Responses
    // ---------------------------------------------------------------------

    public boolean hasResponseFrom(String participantId) {
        return responses.containsKey(participantId);
    }

    public ParticipantResponse getResponse(String participantId) {
        return responses.get(participantId);
    }

    public void addResponse(ParticipantResponse response) {
        if (responses.putIfAbsent(response.participantId(), response) != null) {
            throw new IllegalStateException("Duplicate response for participant " + response.participantId() + " in round " + id);
        }
    }

    public List<ParticipantResponse> getResponses() {
        return new ArrayList<>(responses.values());
    }

    public int responseCount() {
        return responses.size();
    }

    public int correctCount() {
        int n = 0;
        for (ParticipantResponse r : responses.values()) {
            if (r.correct()) n++;
        }
        return n;
    }

    @Override
    public String toString() {
        return "QuestionRound{" +
                "id='" + id + '\'' +
                ", questionId='" + question.id() + '\'' +
                ", index=" + index +
                ", activatedAt=" + activatedAt +
                ", closed=" + closed +
                ", closeReason=" + closeReason +
                ", responses=" + responses.size() +
                '}';
    }
}
