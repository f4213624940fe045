package com.example.livesession.service;

import com.example.livesession.config.SessionProperties;
import com.example.livesession.dto.CreateSessionRequest;
import com.example.livesession.dto.CreatedSession;
import com.example.livesession.dto.JoinResult;
import com.example.livesession.dto.MapPinsData;
import com.example.livesession.dto.ParticipantView;
import com.example.livesession.dto.QuestionView;
import com.example.livesession.dto.RoundResults;
import com.example.livesession.dto.RoundView;
import com.example.livesession.dto.SessionResults;
import com.example.livesession.dto.SessionSnapshot;
import com.example.livesession.dto.SessionView;
import com.example.livesession.dto.WordCloudData;
import com.example.livesession.event.EventPayloads;
import com.example.livesession.event.EventType;
import com.example.livesession.event.SessionEvent;
import com.example.livesession.exception.AlreadySubmittedException;
import com.example.livesession.exception.InvalidCommandException;
import com.example.livesession.exception.InvalidTransitionException;
import com.example.livesession.exception.JoinRejectedException;
import com.example.livesession.exception.NotFoundException;
import com.example.livesession.exception.PresenterOnlyException;
import com.example.livesession.exception.RoundClosedException;
import com.example.livesession.model.AnswerFeedback;
import com.example.livesession.model.CloseReason;
import com.example.livesession.model.GeoPoint;
import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.MapFocus;
import com.example.livesession.model.Participant;
import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionOption;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.QuestionType;
import com.example.livesession.model.ResponsePayload;
import com.example.livesession.model.SegmentState;
import com.example.livesession.model.Session;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.model.SessionStatus;
import com.example.livesession.persistence.SessionArchive;
import com.example.livesession.security.PresenterKeyHasher;
import com.example.livesession.sessions.codec.SessionCodec;
import com.example.livesession.sessions.model.StoredSession;
import com.example.livesession.sessions.service.SessionSnapshotter;
import com.example.livesession.sessions.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Live session engine: lifecycle, roster, question rounds, scoring and broadcasts.
 *
 * <p>Every mutation of a session runs inside {@code synchronized (session)}; events are published
 * while the lock is held, so clients see them in the order they were produced. Sessions never
 * share a lock.</p>
 */
@Service
public class LiveSessionService {

    private static final Logger log = LoggerFactory.getLogger(LiveSessionService.class);

    static final int DEFAULT_POINTS = 1000;
    private static final int MAX_CODE_ATTEMPTS = 3;

    private final SessionRegistry registry;
    private final SessionCodeGenerator codeGenerator;
    private final SessionStateMachine stateMachine;
    private final QuestionRoundController rounds;
    private final AnswerEvaluator evaluator;
    private final ResponseScorer scorer;
    private final LeaderboardEngine leaderboard;
    private final BroadcastCoordinator broadcaster;
    private final SessionAnalytics analytics;
    private final PresenterKeyHasher keyHasher;
    private final SessionStore store;
    private final SessionArchive archive;
    private final SessionProperties props;
    private final Clock clock;

    // --- optional snapshot hook (non-fatal, may be null) ---
    private final SessionSnapshotter snapshotter;

    /** Spring-injected constructor; the snapshotter is optional. */
    @Autowired
    public LiveSessionService(SessionRegistry registry,
                              SessionCodeGenerator codeGenerator,
                              SessionStateMachine stateMachine,
                              QuestionRoundController rounds,
                              AnswerEvaluator evaluator,
                              ResponseScorer scorer,
                              LeaderboardEngine leaderboard,
                              BroadcastCoordinator broadcaster,
                              SessionAnalytics analytics,
                              PresenterKeyHasher keyHasher,
                              SessionStore store,
                              SessionArchive archive,
                              SessionProperties props,
                              Clock clock,
                              ObjectProvider<SessionSnapshotter> snapshotterProvider) {
        this(registry, codeGenerator, stateMachine, rounds, evaluator, scorer, leaderboard, broadcaster,
                analytics, keyHasher, store, archive, props, clock,
                snapshotterProvider != null ? snapshotterProvider.getIfAvailable() : null);
    }

    /** Plain constructor for tests (no Spring context); {@code snapshotter} may be null. */
    public LiveSessionService(SessionRegistry registry,
                              SessionCodeGenerator codeGenerator,
                              SessionStateMachine stateMachine,
                              QuestionRoundController rounds,
                              AnswerEvaluator evaluator,
                              ResponseScorer scorer,
                              LeaderboardEngine leaderboard,
                              BroadcastCoordinator broadcaster,
                              SessionAnalytics analytics,
                              PresenterKeyHasher keyHasher,
                              SessionStore store,
                              SessionArchive archive,
                              SessionProperties props,
                              Clock clock,
                              SessionSnapshotter snapshotter) {
        this.registry = registry;
        this.codeGenerator = codeGenerator;
        this.stateMachine = stateMachine;
        this.rounds = rounds;
        this.evaluator = evaluator;
        this.scorer = scorer;
        this.leaderboard = leaderboard;
        this.broadcaster = broadcaster;
        this.analytics = analytics;
        this.keyHasher = keyHasher;
        this.store = store;
        this.archive = archive;
        this.props = props;
        this.clock = clock;
        this.snapshotter = snapshotter;
    }

    private void snapshot(Session session, String actor) {
        if (snapshotter != null && session != null) {
            snapshotter.onChange(session, (actor != null && !actor.isBlank()) ? actor : "system");
        }
    }

    // =====================================================================
    // Creation & presenter identity
    // =====================================================================

    public CreatedSession createSession(CreateSessionRequest req) {
        if (req == null || req.questions() == null || req.questions().isEmpty()) {
            throw new InvalidCommandException("At least one question is required");
        }
        List<Question> questions = toQuestions(req.questions());
        SessionSettings settings = req.settings() == null ? SessionSettings.defaults() : req.settings();

        Instant now = clock.instant();
        String presenterKey = keyHasher.newKey();
        String presenterKeyHash = keyHasher.hash(presenterKey);

        for (int attempt = 1; ; attempt++) {
            String code = codeGenerator.next(registry::codeInUse);
            Session session = new Session(UUID.randomUUID().toString(), code, req.name(),
                    UUID.randomUUID().toString(), presenterKeyHash, settings, questions, now);
            try {
                registry.register(session);
            } catch (IllegalStateException e) {
                if (attempt >= MAX_CODE_ATTEMPTS) throw e;
                log.debug("Session code {} taken concurrently, retrying", code);
                continue;
            }
            store.saveQuestions(session.getId(), questions);
            log.info("Session created session={} code={} questions={} settings={}",
                    session.getId(), code, questions.size(), settings);
            synchronized (session) {
                snapshot(session, "presenter");
                return new CreatedSession(SessionView.of(session), session.getPresenterId(), presenterKey);
            }
        }
    }

    /** Resolves the presenter of the session with {@code code}; a wrong key is rejected. */
    public PresenterIdentity authenticatePresenter(String code, String presenterKey) {
        Session session = registry.requireByCode(code);
        if (!keyHasher.matches(presenterKey, session.getPresenterKeyHash())) {
            log.warn("Presenter key rejected session={}", session.getId());
            throw new PresenterOnlyException("connect as presenter");
        }
        return new PresenterIdentity(session.getId(), session.getPresenterId());
    }

    /**
     * Maps a presenter key to the requester id used by presenter-only operations.
     * Returns null when the key does not match, which those operations reject.
     */
    public String requesterFor(String sessionId, String presenterKey) {
        Session session = registry.require(sessionId);
        return keyHasher.matches(presenterKey, session.getPresenterKeyHash()) ? session.getPresenterId() : null;
    }

    public void attachConnection(String sessionId, String connectionId, boolean presenter) {
        broadcaster.attach(connectionId, sessionId, presenter);
    }

    public void detachConnection(String sessionId, String connectionId) {
        broadcaster.detach(connectionId, sessionId);
    }

    // =====================================================================
    // Roster
    // =====================================================================

    /** Adds a participant; {@code connectionId} may be null for REST joins. */
    public JoinResult joinSession(String code, String displayName, String connectionId) {
        Session session = registry.requireByCode(code);
        synchronized (session) {
            Instant now = clock.instant();
            SessionSettings settings = session.getSettings();
            if (session.isEnded()) {
                throw new JoinRejectedException("Session has ended");
            }
            if (session.getStatus() != SessionStatus.PENDING && !settings.isAllowLateJoin()) {
                throw new JoinRejectedException("Session already started and late join is disabled");
            }
            int max = settings.getMaxParticipants();
            if (max > 0 && session.participants().size() >= max) {
                throw new JoinRejectedException("Session is full (" + max + " participants)");
            }

            Participant p = session.participants().add(displayName, now);
            p.markConnected(now, connectionId);
            registry.bindParticipant(p.getId(), session.getId());
            broadcaster.attach(connectionId, session.getId(), false);
            session.touch(now);

            log.info("Participant joined session={} participant={} name='{}' total={}",
                    session.getId(), p.getId(), p.getDisplayName(), session.participants().size());
            emit(session, EventType.PARTICIPANT_JOINED, presence(session, p, "joined"), now);
            snapshot(session, p.getId());

            return new JoinResult(ParticipantView.of(p), SessionView.of(session),
                    session.getStatus() == SessionStatus.PENDING, snapshotFor(session, p, false, now));
        }
    }

    /** Marks a known participant connected again and returns the state to render. */
    public SessionSnapshot reconnect(String participantId, String connectionId) {
        Session session = registry.requireByParticipant(participantId);
        synchronized (session) {
            Instant now = clock.instant();
            Participant p = session.participants().find(participantId)
                    .orElseThrow(() -> NotFoundException.participant(participantId));
            boolean wasConnected = p.isConnected();
            String previous = p.getConnectionId();
            if (previous != null && !previous.equals(connectionId)) {
                broadcaster.detach(previous, session.getId());
            }
            p.markConnected(now, connectionId);
            broadcaster.attach(connectionId, session.getId(), false);
            session.touch(now);
            if (!wasConnected) {
                log.info("Participant reconnected session={} participant={}", session.getId(), participantId);
                emit(session, EventType.PARTICIPANT_JOINED, presence(session, p, "reconnected"), now);
            }
            return snapshotFor(session, p, false, now);
        }
    }

    /**
     * Connection loss. The participant stays in the roster and on the leaderboard.
     * A close of a socket the participant has already replaced is ignored.
     *
     * @param connectionId the socket that closed; null when the transport cannot tell
     */
    public void disconnect(String participantId, String connectionId) {
        Session session = registry.findByParticipant(participantId).orElse(null);
        if (session == null) return;
        synchronized (session) {
            Participant p = session.participants().find(participantId).orElse(null);
            if (p == null || !p.isConnected()) return;
            if (connectionId != null && !connectionId.equals(p.getConnectionId())) {
                log.debug("Stale close ignored session={} participant={} conn={} current={}",
                        session.getId(), participantId, connectionId, p.getConnectionId());
                return;
            }
            Instant now = clock.instant();
            p.markDisconnected(now);
            log.info("Participant disconnected session={} participant={}", session.getId(), participantId);
            emit(session, EventType.PARTICIPANT_LEFT, presence(session, p, "disconnected"), now);
            closeIfAllResponded(session, now);
            snapshot(session, participantId);
        }
    }

    /** Explicit leave: removed from roster and leaderboard; past responses stay in round history. */
    public void leaveSession(String participantId) {
        Session session = registry.requireByParticipant(participantId);
        synchronized (session) {
            Instant now = clock.instant();
            Participant p = session.participants().remove(participantId);
            registry.unbindParticipant(participantId);
            if (p == null) throw NotFoundException.participant(participantId);

            session.touch(now);
            log.info("Participant left session={} participant={}", session.getId(), participantId);
            emit(session, EventType.PARTICIPANT_LEFT, presence(session, p, "left"), now);
            emitLeaderboard(session, now);
            closeIfAllResponded(session, now);
            snapshot(session, participantId);
        }
    }

    // =====================================================================
    // Status
    // =====================================================================

    public SessionView startSession(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "start the session");
            if (session.getStatus() != SessionStatus.PENDING) {
                throw new InvalidTransitionException(session.getStatus(), SessionStatus.RUNNING);
            }
            Instant now = clock.instant();
            broadcaster.publish(session, stateMachine.transition(session, requesterId, SessionStatus.RUNNING, now));
            snapshot(session, "presenter");
            return SessionView.of(session);
        }
    }

    public SessionView pauseSession(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            Instant now = clock.instant();
            SessionEvent event = stateMachine.transition(session, requesterId, SessionStatus.PAUSED, now);
            QuestionRound active = session.getActiveRound();
            if (active != null) rounds.pause(active, now);
            rounds.cancelAutoAdvance(session.getId());
            broadcaster.publish(session, event);
            snapshot(session, "presenter");
            return SessionView.of(session);
        }
    }

    public SessionView resumeSession(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "resume the session");
            if (session.getStatus() != SessionStatus.PAUSED) {
                throw new InvalidTransitionException(session.getStatus(), SessionStatus.RUNNING);
            }
            Instant now = clock.instant();
            broadcaster.publish(session, stateMachine.transition(session, requesterId, SessionStatus.RUNNING, now));

            QuestionRound active = session.getActiveRound();
            if (active != null && active.isPaused()) {
                Duration paused = rounds.resume(active, now, deadlineTask(session.getId(), active.getId()));
                emit(session, EventType.TIME_EXTENDED,
                        new EventPayloads.TimeExtended(active.getId(), paused.getSeconds(), active.deadline(), "resumed"),
                        now);
            } else if (active == null && session.getCurrentRound() != null) {
                scheduleAutoAdvance(session, session.getCurrentRound());
            }
            snapshot(session, "presenter");
            return SessionView.of(session);
        }
    }

    public SessionView endSession(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            Instant now = clock.instant();
            SessionEvent event = stateMachine.transition(session, requesterId, SessionStatus.ENDED, now);
            finishEnded(session, event, now);
            return SessionView.of(session);
        }
    }

    /** Closes the open round, freezes the final leaderboard and empties the live roster. */
    private void finishEnded(Session session, SessionEvent statusEvent, Instant now) {
        broadcaster.publish(session, statusEvent);

        QuestionRound active = session.getActiveRound();
        if (active != null) closeRound(session, active, CloseReason.SESSION_ENDED, now, false);
        rounds.cancelAll(session);

        List<Participant> all = session.participants().all();
        List<LeaderboardEntry> finalBoard = leaderboard.compute(all);
        session.setFinalLeaderboard(finalBoard);
        emit(session, EventType.SESSION_ENDED, new EventPayloads.SessionEnded(now, finalBoard), now);

        archiveResults(session);
        for (Participant p : all) registry.unbindParticipant(p.getId());
        session.participants().clear();

        log.info("Session ended session={} rounds={} participants={}",
                session.getId(), session.getRounds().size(), finalBoard.size());
        snapshot(session, "system");
    }

    private void archiveResults(Session session) {
        if (!archive.isEnabled()) return;
        try {
            archive.archive(analytics.sessionResults(session, session.getFinalLeaderboard()));
        } catch (RuntimeException e) {
            log.warn("Archiving results failed session={}: {}", session.getId(), e.toString());
        }
    }

    /** Ends (if needed) and forgets a session; used by the idle sweep. */
    public boolean terminate(String sessionId, String reason) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null) return false;
        synchronized (session) {
            Instant now = clock.instant();
            if (!session.isEnded()) {
                finishEnded(session, stateMachine.systemTransition(session, SessionStatus.ENDED, now), now);
            }
            rounds.cancelAll(session);
            registry.remove(sessionId);
        }
        if (snapshotter != null) snapshotter.discard(sessionId);
        synchronized (session) {
            store.save(SessionCodec.toStored(session, clock.instant()));
        }
        log.info("Session terminated session={} reason={}", sessionId, reason);
        return true;
    }

    /** Drops stored snapshots of forgotten sessions written before {@code cutoff}. */
    public int purgeStored(Instant cutoff) {
        int removed = store.deleteOlderThan(cutoff);
        if (removed > 0) log.info("Purged {} stored session(s) older than {}", removed, cutoff);
        return removed;
    }

    // =====================================================================
    // Rounds
    // =====================================================================

    /**
     * Activates {@code questionId}, or the next question in order when it is null.
     * Re-activating the open round's question returns it unchanged.
     */
    public RoundView activateQuestion(String sessionId, String requesterId, String questionId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "activate questions");
            return activate(session, questionId, clock.instant());
        }
    }

    private RoundView activate(Session session, String questionId, Instant now) {
        if (session.getStatus() != SessionStatus.RUNNING) {
            throw new InvalidTransitionException(session.getStatus(),
                    "Session must be Running to activate a question (is " + session.getStatus().wireName() + ")");
        }
        Question question;
        if (questionId == null || questionId.isBlank()) {
            question = session.nextQuestion()
                    .orElseThrow(() -> new NotFoundException("No more questions in session " + session.getId()));
        } else {
            question = session.findQuestion(questionId.trim())
                    .orElseThrow(() -> NotFoundException.question(questionId));
        }

        int total = session.getQuestions().size();
        QuestionRound open = session.getActiveRound();
        if (open != null && open.getQuestionId().equals(question.id())) {
            log.debug("Activate ignored, already open session={} round={}", session.getId(), open.getId());
            return RoundView.of(open, total, now);
        }
        if (open != null) closeRound(session, open, CloseReason.SKIPPED, now, false);
        rounds.cancelAutoAdvance(session.getId());

        QuestionRound round = rounds.activate(session, question, now).round();
        rounds.scheduleDeadline(round, now, deadlineTask(session.getId(), round.getId()));
        session.touch(now);

        emit(session, EventType.QUESTION_ACTIVATED, new EventPayloads.QuestionActivated(
                round.getId(),
                round.getQuestionId(),
                round.getType(),
                QuestionView.of(round.getQuestion()),
                round.getPointValue(),
                round.getTimeLimitSeconds(),
                round.getActivatedAt(),
                round.deadline(),
                round.getIndex(),
                total), now);
        snapshot(session, "presenter");
        return RoundView.of(round, total, now);
    }

    public RoundView skipQuestion(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "skip questions");
            QuestionRound active = session.getActiveRound();
            if (active == null) throw new RoundClosedException("No active round to skip");
            Instant now = clock.instant();
            closeRound(session, active, CloseReason.SKIPPED, now, true);
            return RoundView.of(active, session.getQuestions().size(), now);
        }
    }

    /** @param roundId optional; when given it must be the open round */
    public RoundView extendTime(String sessionId, String requesterId, String roundId, int additionalSeconds) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "extend the time");
            int max = props.getMaxExtensionSeconds();
            if (additionalSeconds < 1 || additionalSeconds > max) {
                throw new InvalidCommandException("additionalSeconds must be between 1 and " + max);
            }
            if (roundId != null && session.findRound(roundId).isEmpty()) throw NotFoundException.round(roundId);

            QuestionRound active = session.getActiveRound();
            if (active == null) throw new RoundClosedException("No active round to extend");
            if (roundId != null && !roundId.equals(active.getId())) throw RoundClosedException.forRound(roundId);

            Instant now = clock.instant();
            if (active.isPaused()) {
                active.extend(additionalSeconds * 1000L);
            } else {
                rounds.extend(active, additionalSeconds, now, deadlineTask(session.getId(), active.getId()));
            }
            session.touch(now);
            log.info("Round extended session={} round={} by={}s endsAt={}",
                    session.getId(), active.getId(), additionalSeconds, active.deadline());
            emit(session, EventType.TIME_EXTENDED,
                    new EventPayloads.TimeExtended(active.getId(), additionalSeconds, active.deadline(), "extended"), now);
            snapshot(session, "presenter");
            return RoundView.of(active, session.getQuestions().size(), now);
        }
    }

    /** Timer callback; a stale or early firing is ignored or re-armed. */
    public void handleRoundDeadline(String sessionId, String roundId) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null) return;
        synchronized (session) {
            QuestionRound round = session.findRound(roundId).orElse(null);
            if (round == null || round.isClosed() || round.isPaused() || session.isEnded()) return;
            Instant now = clock.instant();
            if (round.remainingMillis(now) > 0) {
                rounds.scheduleDeadline(round, now, deadlineTask(sessionId, roundId));
                return;
            }
            closeRound(session, round, CloseReason.TIMEOUT, now, true);
        }
    }

    /** Auto-advance callback: activates the next question if nothing changed meanwhile. */
    public void autoAdvance(String sessionId, String closedRoundId) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null) return;
        synchronized (session) {
            QuestionRound current = session.getCurrentRound();
            if (session.getStatus() != SessionStatus.RUNNING
                    || current == null
                    || !current.getId().equals(closedRoundId)
                    || current.isOpen()
                    || session.nextQuestion().isEmpty()) {
                return;
            }
            log.info("Auto-advancing session={} after round={}", sessionId, closedRoundId);
            activate(session, null, clock.instant());
        }
    }

    private Runnable deadlineTask(String sessionId, String roundId) {
        return () -> handleRoundDeadline(sessionId, roundId);
    }

    /** Exactly-once close plus its events; returns false when already closed. */
    private boolean closeRound(Session session, QuestionRound round, CloseReason reason, Instant now,
                               boolean allowAutoAdvance) {
        if (!rounds.close(round, reason, now)) return false;

        if (reason == CloseReason.SKIPPED) {
            emit(session, EventType.QUESTION_SKIPPED,
                    new EventPayloads.QuestionSkipped(round.getId(), round.getQuestionId(), now), now);
        }
        boolean reveal = session.getSettings().isShowCorrectAnswers();
        emit(session, EventType.QUESTION_CLOSED, new EventPayloads.QuestionClosed(
                round.getId(),
                round.getQuestionId(),
                reason,
                reveal ? round.getQuestion().correctAnswerDisplay() : null,
                reveal ? round.getQuestion().explanation() : null,
                round.responseCount(),
                round.correctCount(),
                now), now);
        emitLeaderboard(session, now);
        session.touch(now);

        if (allowAutoAdvance && reason != CloseReason.SESSION_ENDED) scheduleAutoAdvance(session, round);
        snapshot(session, "system");
        return true;
    }

    private void closeIfAllResponded(Session session, Instant now) {
        QuestionRound active = session.getActiveRound();
        if (active != null && !active.isPaused() && rounds.allResponded(session, active)) {
            closeRound(session, active, CloseReason.ALL_RESPONDED, now, true);
        }
    }

    private void scheduleAutoAdvance(Session session, QuestionRound closed) {
        SessionSettings settings = session.getSettings();
        if (!settings.isAutoAdvance()
                || session.getStatus() != SessionStatus.RUNNING
                || session.nextQuestion().isEmpty()) {
            return;
        }
        String sessionId = session.getId();
        String roundId = closed.getId();
        rounds.scheduleAutoAdvance(session, Duration.ofSeconds(settings.getAutoAdvanceDelaySeconds()),
                () -> autoAdvance(sessionId, roundId));
    }

    // =====================================================================
    // Responses
    // =====================================================================

    /**
     * Scores a response exactly once per (participant, round). The returned feedback goes to the
     * submitter only; the session learns counts, never the answer.
     *
     * @param clientTimestamp informational, never used for scoring
     */
    public AnswerFeedback submitResponse(String participantId, String roundId, ResponsePayload payload,
                                         Instant clientTimestamp) {
        Session session = registry.requireByParticipant(participantId);
        synchronized (session) {
            Instant now = clock.instant();
            Participant p = session.participants().find(participantId)
                    .orElseThrow(() -> NotFoundException.participant(participantId));
            QuestionRound round = session.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));

            if (round.hasResponseFrom(participantId)) {
                log.warn("Duplicate response rejected session={} round={} participant={}",
                        session.getId(), roundId, participantId);
                throw new AlreadySubmittedException(participantId, roundId);
            }
            if (round.isClosed() || round != session.getActiveRound()) throw RoundClosedException.forRound(roundId);
            if (session.getStatus() == SessionStatus.PAUSED) throw new RoundClosedException("Session is paused");
            if (session.getStatus() != SessionStatus.RUNNING) throw RoundClosedException.forRound(roundId);
            if (round.isExpired(now)) {
                // timer not yet fired
                closeRound(session, round, CloseReason.TIMEOUT, now, true);
                throw RoundClosedException.forRound(roundId);
            }

            AnswerEvaluator.Evaluation evaluation = evaluator.evaluate(round.getQuestion(), payload);
            ResponseScorer.Score score = scorer.score(round, evaluation.correct(), round.elapsedMillis(now),
                    session.getSettings().isPointsForSpeed());

            ParticipantResponse response = new ParticipantResponse(
                    participantId,
                    p.getDisplayName(),
                    session.getId(),
                    round.getId(),
                    round.getQuestionId(),
                    payload,
                    now,
                    clientTimestamp,
                    score.elapsedMillis(),
                    evaluation.correct(),
                    score.basePoints(),
                    score.speedBonus(),
                    score.total(),
                    evaluation.distanceMeters());
            round.addResponse(response);
            p.recordResponse(response, round.getType().isScored());
            p.bumpLastSeen(now);
            session.touch(now);
            store.appendResponse(response);

            log.debug("Response scored session={} round={} participant={} correct={} points={} bonus={} elapsedMs={}",
                    session.getId(), roundId, participantId, evaluation.correct(), score.total(),
                    score.speedBonus(), score.elapsedMillis());

            emit(session, EventType.RESPONSE_SUBMITTED, new EventPayloads.ResponseSubmitted(
                    round.getId(), participantId, round.responseCount(), session.participants().size()), now);
            emitLeaderboard(session, now);

            AnswerFeedback feedback = feedbackFor(session, round, response);
            if (rounds.allResponded(session, round)) {
                closeRound(session, round, CloseReason.ALL_RESPONDED, now, true);
            }
            snapshot(session, participantId);
            return feedback;
        }
    }

    private AnswerFeedback feedbackFor(Session session, QuestionRound round, ParticipantResponse r) {
        boolean reveal = session.getSettings().isShowCorrectAnswers();
        return new AnswerFeedback(
                r.correct(),
                r.pointsAwarded(),
                r.speedBonus(),
                reveal ? round.getQuestion().correctAnswerDisplay() : null,
                reveal ? round.getQuestion().explanation() : null,
                r.distanceMeters());
    }

    // =====================================================================
    // Presenter focus
    // =====================================================================

    public MapFocus updateTeacherFocus(String sessionId, String requesterId, double latitude, double longitude,
                                       double zoom, Double bearing, Double pitch) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            stateMachine.requirePresenter(session, requesterId, "update the map focus");
            if (session.isEnded()) throw new InvalidTransitionException(session.getStatus(), "Session has ended");
            try {
                GeoPoint.of(latitude, longitude);
            } catch (IllegalArgumentException e) {
                throw new InvalidCommandException(e.getMessage(), e);
            }
            if (Double.isNaN(zoom) || zoom < 0 || zoom > 24) {
                throw new InvalidCommandException("zoom must be between 0 and 24");
            }
            Instant now = clock.instant();
            MapFocus focus = new MapFocus(latitude, longitude, zoom, bearing, pitch, now);
            session.setFocus(focus);
            session.touch(now);
            emit(session, EventType.TEACHER_FOCUS_CHANGED,
                    new EventPayloads.TeacherFocusChanged(latitude, longitude, zoom, bearing, pitch, now), now);
            return focus;
        }
    }

    public boolean syncMapLock(String sessionId, String requesterId, boolean locked) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            requireLivePresenter(session, requesterId, "lock the map");
            Instant now = clock.instant();
            session.setMapLocked(locked);
            session.touch(now);
            emit(session, EventType.MAP_LOCK_STATE_SYNC, new EventPayloads.MapLockStateSync(locked, now), now);
            snapshot(session, requesterId);
            return locked;
        }
    }

    public SegmentState syncSegment(String sessionId, String requesterId, int segmentIndex, String segmentId,
                                    String segmentName, boolean playing) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            requireLivePresenter(session, requesterId, "change the segment");
            if (segmentIndex < 0) throw new InvalidCommandException("segmentIndex must not be negative");
            Instant now = clock.instant();
            SegmentState segment = new SegmentState(segmentIndex, blankToNull(segmentId), blankToNull(segmentName),
                    playing, now);
            session.setSegment(segment);
            session.touch(now);
            emit(session, EventType.SEGMENT_SYNC, new EventPayloads.SegmentSync(segmentIndex, segment.segmentId(),
                    segment.segmentName(), playing, now), now);
            snapshot(session, requesterId);
            return segment;
        }
    }

    public String syncMapLayer(String sessionId, String requesterId, String layerKey) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            requireLivePresenter(session, requesterId, "change the map layer");
            if (layerKey == null || layerKey.isBlank()) throw new InvalidCommandException("layerKey is required");
            Instant now = clock.instant();
            String key = layerKey.trim();
            session.setMapLayer(key);
            session.touch(now);
            emit(session, EventType.MAP_LAYER_SYNC, new EventPayloads.MapLayerSync(key, now), now);
            snapshot(session, requesterId);
            return key;
        }
    }

    /**
     * Puts the results of a closed round on every screen.
     *
     * @param roundId null for the current round
     */
    public RoundResults showQuestionResults(String sessionId, String requesterId, String roundId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            requireLivePresenter(session, requesterId, "show question results");
            QuestionRound round = roundId == null ? session.getCurrentRound() : requireRound(session, roundId);
            if (round == null) throw new InvalidCommandException("No question has been activated yet");
            if (round.isOpen()) {
                throw new InvalidCommandException("Round " + round.getId() + " is still open");
            }
            Instant now = clock.instant();
            RoundResults results = analytics.roundResults(round);
            session.setShownResultsRoundId(round.getId());
            session.touch(now);
            emit(session, EventType.QUESTION_RESULTS, new EventPayloads.QuestionResults(round.getId(),
                    round.getQuestionId(), results.responses(), results.optionCounts(), results.correctAnswer(), now),
                    now);
            snapshot(session, requesterId);
            return results;
        }
    }

    private void requireLivePresenter(Session session, String requesterId, String action) {
        stateMachine.requirePresenter(session, requesterId, action);
        if (session.isEnded()) throw new InvalidTransitionException(session.getStatus(), "Session has ended");
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public SessionView getSession(String sessionId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            return SessionView.of(session);
        }
    }

    public SessionView getSessionByCode(String code) {
        Session session = registry.requireByCode(code);
        synchronized (session) {
            return SessionView.of(session);
        }
    }

    /**
     * State for a (re)connecting client.
     *
     * @param requesterId participant id, presenter id, or null for an anonymous view
     */
    public SessionSnapshot snapshot(String sessionId, String requesterId) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            boolean presenter = session.isPresenter(requesterId);
            Participant p = presenter ? null : session.participants().find(requesterId).orElse(null);
            if (requesterId != null && !presenter && p == null) throw NotFoundException.participant(requesterId);
            return snapshotFor(session, p, presenter, clock.instant());
        }
    }

    private SessionSnapshot snapshotFor(Session session, Participant p, boolean presenter, Instant now) {
        QuestionRound current = session.getCurrentRound();
        RoundView roundView = current == null ? null : RoundView.of(current, session.getQuestions().size(), now);

        Boolean hasAnswered = null;
        AnswerFeedback yours = null;
        if (p != null) {
            ParticipantResponse r = current == null ? null : current.getResponse(p.getId());
            hasAnswered = r != null;
            if (r != null) yours = feedbackFor(session, current, r);
        }

        return new SessionSnapshot(
                SessionView.of(session),
                roundView,
                hasAnswered,
                yours,
                p == null ? null : ParticipantView.of(p),
                visibleLeaderboard(session, presenter),
                session.getFocus(),
                session.isMapLocked(),
                session.getMapLayer(),
                session.getSegment(),
                session.findRound(session.getShownResultsRoundId()).map(analytics::roundResults).orElse(null),
                now);
    }

    /** @param limit non-positive for all entries */
    public List<LeaderboardEntry> leaderboard(String sessionId, String requesterId, int limit) {
        Session session = registry.require(sessionId);
        synchronized (session) {
            return leaderboard.top(visibleLeaderboard(session, session.isPresenter(requesterId)), limit);
        }
    }

    private List<LeaderboardEntry> visibleLeaderboard(Session session, boolean presenter) {
        if (!presenter && !session.getSettings().isShowLeaderboard()) return List.of();
        if (session.isEnded()) return session.getFinalLeaderboard();
        return leaderboard.compute(session.participants().all());
    }

    /** Live sessions are computed; swept ones come from the archive, then from the store. */
    public SessionResults results(String sessionId) {
        Session session = registry.find(sessionId).orElse(null);
        if (session == null) {
            Optional<SessionResults> archived = archive.find(sessionId);
            if (archived.isPresent()) return archived.get();
            session = requireReadable(sessionId);
        }
        synchronized (session) {
            List<LeaderboardEntry> board = session.isEnded()
                    ? session.getFinalLeaderboard()
                    : leaderboard.compute(session.participants().all());
            return analytics.sessionResults(session, board);
        }
    }

    public RoundResults roundResults(String sessionId, String roundId) {
        Session session = requireReadable(sessionId);
        synchronized (session) {
            return analytics.roundResults(requireRound(session, roundId));
        }
    }

    public WordCloudData wordCloud(String sessionId, String roundId) {
        Session session = requireReadable(sessionId);
        synchronized (session) {
            QuestionRound round = requireRound(session, roundId);
            if (round.getType() != QuestionType.WORD_CLOUD) {
                throw new InvalidCommandException("Round " + roundId + " is not a WordCloud round");
            }
            return analytics.wordCloud(round);
        }
    }

    public MapPinsData mapPins(String sessionId, String roundId) {
        Session session = requireReadable(sessionId);
        synchronized (session) {
            QuestionRound round = requireRound(session, roundId);
            if (round.getType() != QuestionType.PIN_ON_MAP) {
                throw new InvalidCommandException("Round " + roundId + " is not a PinOnMap round");
            }
            return analytics.mapPins(round);
        }
    }

    /** Session id of a participant, for transports that only know the participant. */
    public String sessionIdOf(String participantId) {
        return registry.requireByParticipant(participantId).getId();
    }

    /** The live session, or a read-only copy rebuilt from the store once it has been swept. */
    private Session requireReadable(String sessionId) {
        Optional<Session> live = registry.find(sessionId);
        if (live.isPresent()) return live.get();
        StoredSession stored = store.load(sessionId).orElseThrow(() -> NotFoundException.session(sessionId));
        log.debug("Serving results of swept session={} from the store", sessionId);
        return SessionCodec.restore(stored, store.loadQuestions(sessionId), store.loadResponses(sessionId));
    }

    private static QuestionRound requireRound(Session session, String roundId) {
        return session.findRound(roundId).orElseThrow(() -> NotFoundException.round(roundId));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private void emit(Session session, EventType type, Object payload, Instant now) {
        broadcaster.publish(session, SessionEvent.next(session, type, now, payload));
    }

    private void emitLeaderboard(Session session, Instant now) {
        emit(session, EventType.LEADERBOARD_UPDATED,
                new EventPayloads.LeaderboardUpdated(leaderboard.compute(session.participants().all())), now);
    }

    private static EventPayloads.ParticipantPresence presence(Session session, Participant p, String reason) {
        return new EventPayloads.ParticipantPresence(p.getId(), p.getDisplayName(), reason,
                session.participants().size(), session.participants().connectedCount());
    }

    /** Validates the authored questions and fills in generated ids and defaults. */
    List<Question> toQuestions(List<CreateSessionRequest.QuestionInput> inputs) {
        List<Question> out = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < inputs.size(); i++) {
            CreateSessionRequest.QuestionInput in = inputs.get(i);
            if (in == null || in.type() == null) throw new InvalidCommandException("Question " + (i + 1) + " has no type");
            if (in.text() == null || in.text().isBlank()) {
                throw new InvalidCommandException("Question " + (i + 1) + " has no text");
            }
            String id = (in.id() == null || in.id().isBlank()) ? "q" + (i + 1) : in.id().trim();
            if (!ids.add(id)) throw new InvalidCommandException("Duplicate question id " + id);

            List<QuestionOption> options = new ArrayList<>();
            GeoPoint target = null;
            switch (in.type()) {
                case MULTIPLE_CHOICE, TRUE_FALSE -> {
                    if (in.options() == null || in.options().size() < 2) {
                        throw new InvalidCommandException("Question " + id + " needs at least two options");
                    }
                    Set<String> optionIds = new HashSet<>();
                    boolean anyCorrect = false;
                    for (int j = 0; j < in.options().size(); j++) {
                        CreateSessionRequest.OptionInput o = in.options().get(j);
                        String oid = (o.id() == null || o.id().isBlank()) ? id + "-o" + (j + 1) : o.id().trim();
                        if (!optionIds.add(oid)) throw new InvalidCommandException("Duplicate option id " + oid);
                        anyCorrect |= o.correct();
                        options.add(new QuestionOption(oid, o.text(), o.correct(),
                                o.displayOrder() == null ? j : o.displayOrder()));
                    }
                    if (!anyCorrect) throw new InvalidCommandException("Question " + id + " has no correct option");
                }
                case SHORT_ANSWER -> {
                    if (in.acceptedAnswers() == null || in.acceptedAnswers().stream().allMatch(a -> a == null || a.isBlank())) {
                        throw new InvalidCommandException("Question " + id + " needs at least one accepted answer");
                    }
                }
                case PIN_ON_MAP -> {
                    if (in.targetLatitude() == null || in.targetLongitude() == null) {
                        throw new InvalidCommandException("Question " + id + " needs a target coordinate");
                    }
                    if (in.acceptanceRadiusMeters() == null || in.acceptanceRadiusMeters() <= 0) {
                        throw new InvalidCommandException("Question " + id + " needs a positive acceptance radius");
                    }
                    try {
                        target = GeoPoint.of(in.targetLatitude(), in.targetLongitude());
                    } catch (IllegalArgumentException e) {
                        throw new InvalidCommandException(e.getMessage(), e);
                    }
                }
                default -> { }
            }

            int points = in.points() != null
                    ? Math.max(0, in.points())
                    : (in.type() == QuestionType.WORD_CLOUD ? 0 : DEFAULT_POINTS);
            int limit = (in.timeLimitSeconds() == null || in.timeLimitSeconds() <= 0)
                    ? props.getDefaultTimeLimitSeconds()
                    : in.timeLimitSeconds();

            out.add(new Question(id, in.type(), in.text().trim(), options, in.acceptedAnswers(), target,
                    in.acceptanceRadiusMeters(), points, limit, in.hintText(), in.explanation()));
        }
        return out;
    }

    /** Presenter identity resolved from a presenter key. */
    public record PresenterIdentity(String sessionId, String presenterId) { }
}
