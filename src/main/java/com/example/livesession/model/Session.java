package com.example.livesession.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Session aggregate: status, questions, rounds, participants and the event sequence.
 * LiveSessionService synchronizes on Session instances, so this class itself does not add extra locking.
 */
public class Session {

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    private final String id;
    private final String code;
    private final String name;
    private final String presenterId;
    private final String presenterKeyHash;
    private final SessionSettings settings;
    private final Instant createdAt;

    // ---------------------------------------------------------------------
    // Questions & rounds
    // ---------------------------------------------------------------------

    private final List<Question> questions;
    private final Map<String, Question> questionsById = new LinkedHashMap<>();
    private final Map<String, QuestionRound> rounds = new LinkedHashMap<>();

    /** Last activated round; may already be closed. */
    private QuestionRound currentRound;

    /** Index of the last activated question, -1 before the first activation. */
    private int currentIndex = -1;

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    private SessionStatus status = SessionStatus.PENDING;
    private Instant startedAt;
    private Instant endedAt;
    private volatile Instant lastActivityAt;

    /** Sequence number of the last emitted event. */
    private long seq;

    private final ParticipantRegistry participants;
    private MapFocus focus;
    private boolean mapLocked;
    private String mapLayer;
    private SegmentState segment;
    /** Round whose results the presenter last put on screen. */
    private String shownResultsRoundId;
    private List<LeaderboardEntry> finalLeaderboard = List.of();

    public Session(String id, String code, String name, String presenterId, String presenterKeyHash,
                   SessionSettings settings, List<Question> questions, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.code = Objects.requireNonNull(code, "code");
        this.name = (name == null || name.isBlank()) ? "Live session" : name.trim();
        this.presenterId = Objects.requireNonNull(presenterId, "presenterId");
        this.presenterKeyHash = presenterKeyHash;
        this.settings = (settings == null) ? SessionSettings.defaults() : settings.copy();
        this.questions = List.copyOf(questions == null ? List.of() : questions);
        for (Question q : this.questions) {
            questionsById.put(q.id(), q);
        }
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivityAt = createdAt;
        this.participants = new ParticipantRegistry(id);
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getId() { return id; }
    public String getCode() { return code; }
    public String getName() { return name; }
    public String getPresenterId() { return presenterId; }
    public String getPresenterKeyHash() { return presenterKeyHash; }
    public SessionSettings getSettings() { return settings; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isPresenter(String requesterId) {
        return requesterId != null && presenterId.equals(requesterId);
    }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = Objects.requireNonNull(status, "status"); }
    public boolean isEnded() { return status == SessionStatus.ENDED; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public Instant getLastActivityAt() { return lastActivityAt; }
    public void touch(Instant now) { this.lastActivityAt = now; }

    public long getSeq() { return seq; }

    /** Allocates the sequence number of the next emitted event. */
    public long nextSeq() { return ++seq; }

    /** Only for sessions rebuilt from the store. */
    public void restoreSeq(long seq) { this.seq = seq; }

    public ParticipantRegistry participants() { return participants; }

    public MapFocus getFocus() { return focus; }
    public void setFocus(MapFocus focus) { this.focus = focus; }

    public boolean isMapLocked() { return mapLocked; }
    public void setMapLocked(boolean mapLocked) { this.mapLocked = mapLocked; }

    public String getMapLayer() { return mapLayer; }
    public void setMapLayer(String mapLayer) { this.mapLayer = mapLayer; }

    public SegmentState getSegment() { return segment; }
    public void setSegment(SegmentState segment) { this.segment = segment; }

    public String getShownResultsRoundId() { return shownResultsRoundId; }
    public void setShownResultsRoundId(String shownResultsRoundId) { this.shownResultsRoundId = shownResultsRoundId; }

    public List<LeaderboardEntry> getFinalLeaderboard() { return finalLeaderboard; }
    public void setFinalLeaderboard(List<LeaderboardEntry> finalLeaderboard) {
        this.finalLeaderboard = List.copyOf(finalLeaderboard);
    }

    // ---------------------------------------------------------------------
    // Questions
    // ---------------------------------------------------------------------

    public List<Question> getQuestions() { return questions; }

    public List<String> getQuestionIds() {
        List<String> ids = new ArrayList<>();
        for (Question q : questions) ids.add(q.id());
        return ids;
    }

    public Optional<Question> findQuestion(String questionId) {
        if (questionId == null) return Optional.empty();
        return Optional.ofNullable(questionsById.get(questionId));
    }

    public int indexOf(String questionId) {
        for (int i = 0; i < questions.size(); i++) {
            if (questions.get(i).id().equals(questionId)) return i;
        }
        return -1;
    }

    /** The question after the last activated one, if any. */
    public Optional<Question> nextQuestion() {
        int next = currentIndex + 1;
        return next < questions.size() ? Optional.of(questions.get(next)) : Optional.empty();
    }

    public int getCurrentIndex() { return currentIndex; }

    // ---------------------------------------------------------------------
    // Rounds
    // ---------------------------------------------------------------------

    public void addRound(QuestionRound round) {
        rounds.put(round.getId(), round);
        currentRound = round;
        currentIndex = round.getIndex();
    }

    public QuestionRound getCurrentRound() { return currentRound; }

    /** The current round if it is still accepting responses. */
    public QuestionRound getActiveRound() {
        return (currentRound != null && currentRound.isOpen()) ? currentRound : null;
    }

    public Optional<QuestionRound> findRound(String roundId) {
        if (roundId == null) return Optional.empty();
        return Optional.ofNullable(rounds.get(roundId));
    }

    public List<QuestionRound> getRounds() {
        return Collections.unmodifiableList(new ArrayList<>(rounds.values()));
    }

    @Override
    public String toString() {
        return "Session{" +
                "id='" + id + '\'' +
                ", code='" + code + '\'' +
                ", status=" + status +
                ", questions=" + questions.size() +
                ", rounds=" + rounds.size() +
                ", participants=" + participants.size() +
                ", seq=" + seq +
                '}';
    }
}
