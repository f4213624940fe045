package com.example.livesession.service;

import com.example.livesession.config.SessionProperties;
import com.example.livesession.model.CloseReason;
import com.example.livesession.model.Participant;
import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Round lifecycle and its timers. One deadline task per round id and at most one
 * auto-advance task per session; both are cancelled on close, pause and end.
 *
 * <p>All methods except the timer callbacks themselves are called with the session lock held.</p>
 */
@Component
public class QuestionRoundController {

    private static final Logger log = LoggerFactory.getLogger(QuestionRoundController.class);

    private final RoundScheduler scheduler;
    private final SessionProperties props;

    private final Map<String, RoundScheduler.Cancellable> deadlines = new ConcurrentHashMap<>();
    private final Map<String, RoundScheduler.Cancellable> autoAdvance = new ConcurrentHashMap<>();

    public QuestionRoundController(RoundScheduler scheduler, SessionProperties props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    /**
     * Opens a round for {@code question}. If the session's open round already serves this
     * question, that round is returned unchanged and {@code created} is false.
     * Another open round must have been closed by the caller.
     */
    public ActivationResult activate(Session session, Question question, Instant now) {
        QuestionRound open = session.getActiveRound();
        if (open != null && open.getQuestionId().equals(question.id())) {
            return new ActivationResult(open, false);
        }
        if (open != null) {
            throw new IllegalStateException("Round " + open.getId() + " is still open");
        }

        Question effective = question.timeLimitSeconds() > 0
                ? question
                : question.withTimeLimit(props.getDefaultTimeLimitSeconds());
        QuestionRound round = new QuestionRound(UUID.randomUUID().toString(), session.getId(), effective,
                session.indexOf(question.id()), now);
        session.addRound(round);
        log.info("Round activated session={} round={} question={} index={} limit={}s",
                session.getId(), round.getId(), question.id(), round.getIndex(), effective.timeLimitSeconds());
        return new ActivationResult(round, true);
    }

    /** Exactly-once: returns false when the round was already closed. */
    public boolean close(QuestionRound round, CloseReason reason, Instant now) {
        boolean closed = round.close(reason, now);
        cancelDeadline(round.getId());
        if (closed) {
            log.info("Round closed session={} round={} reason={} responses={}",
                    round.getSessionId(), round.getId(), reason, round.responseCount());
        }
        return closed;
    }

    /** (Re)arms the deadline task for the round's current deadline. */
    public void scheduleDeadline(QuestionRound round, Instant now, Runnable onDeadline) {
        cancelDeadline(round.getId());
        if (round.isClosed() || round.isPaused()) return;
        Duration delay = Duration.ofMillis(round.remainingMillis(now));
        deadlines.put(round.getId(), scheduler.schedule(delay, onDeadline));
        log.debug("Deadline armed round={} in={}ms", round.getId(), delay.toMillis());
    }

    public void cancelDeadline(String roundId) {
        RoundScheduler.Cancellable c = deadlines.remove(roundId);
        if (c != null) c.cancel();
    }

    /** Freezes the countdown. */
    public void pause(QuestionRound round, Instant now) {
        round.pause(now);
        cancelDeadline(round.getId());
    }

    /** Unfreezes the countdown; returns how long the round was paused. */
    public Duration resume(QuestionRound round, Instant now, Runnable onDeadline) {
        Instant before = round.deadline();
        round.resume(now);
        scheduleDeadline(round, now, onDeadline);
        return Duration.between(before, round.deadline());
    }

    public void extend(QuestionRound round, int seconds, Instant now, Runnable onDeadline) {
        round.extend(seconds * 1000L);
        scheduleDeadline(round, now, onDeadline);
    }

    /** True when at least one participant is connected and every connected one has answered. */
    public boolean allResponded(Session session, QuestionRound round) {
        List<Participant> connected = session.participants().connected();
        if (connected.isEmpty()) return false;
        for (Participant p : connected) {
            if (!round.hasResponseFrom(p.getId())) return false;
        }
        return true;
    }

    // --- auto-advance ---

    public void scheduleAutoAdvance(Session session, Duration delay, Runnable task) {
        cancelAutoAdvance(session.getId());
        autoAdvance.put(session.getId(), scheduler.schedule(delay, task));
        log.debug("Auto-advance armed session={} in={}ms", session.getId(), delay.toMillis());
    }

    public void cancelAutoAdvance(String sessionId) {
        RoundScheduler.Cancellable c = autoAdvance.remove(sessionId);
        if (c != null) c.cancel();
    }

    public boolean hasPendingDeadline(String roundId) {
        return deadlines.containsKey(roundId);
    }

    /** Cancels every timer of the session. */
    public void cancelAll(Session session) {
        for (QuestionRound r : session.getRounds()) {
            cancelDeadline(r.getId());
        }
        cancelAutoAdvance(session.getId());
    }

    public record ActivationResult(QuestionRound round, boolean created) { }
}
