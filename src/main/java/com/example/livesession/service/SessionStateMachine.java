package com.example.livesession.service;

import com.example.livesession.event.EventPayloads;
import com.example.livesession.event.EventType;
import com.example.livesession.event.SessionEvent;
import com.example.livesession.exception.InvalidTransitionException;
import com.example.livesession.exception.PresenterOnlyException;
import com.example.livesession.model.Session;
import com.example.livesession.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Legal status moves of a session. Checks run before anything is applied, so a rejected
 * request leaves the session untouched. Caller holds the session lock.
 */
@Component
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    /** Presenter-requested transition. */
    public SessionEvent transition(Session session, String requesterId, SessionStatus target, Instant now) {
        requirePresenter(session, requesterId, actionFor(target));
        return apply(session, target, now);
    }

    /** Transition triggered by the server itself (idle sweep, shutdown). */
    public SessionEvent systemTransition(Session session, SessionStatus target, Instant now) {
        return apply(session, target, now);
    }

    public void requirePresenter(Session session, String requesterId, String action) {
        if (!session.isPresenter(requesterId)) {
            log.warn("Rejected presenter-only action session={} action={} requester={}",
                    session.getId(), action, requesterId);
            throw new PresenterOnlyException(action);
        }
    }

    private SessionEvent apply(Session session, SessionStatus target, Instant now) {
        SessionStatus current = session.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current, target);
        }

        session.setStatus(target);
        if (target == SessionStatus.RUNNING && session.getStartedAt() == null) session.setStartedAt(now);
        if (target == SessionStatus.ENDED) session.setEndedAt(now);
        session.touch(now);

        long seq = session.nextSeq();
        log.info("Session status session={} {} -> {} seq={}", session.getId(), current, target, seq);
        return new SessionEvent(EventType.SESSION_STATUS_CHANGED, session.getId(), seq, now,
                new EventPayloads.StatusChanged(target, current, seq));
    }

    private static String actionFor(SessionStatus target) {
        return switch (target) {
            case RUNNING -> "start or resume the session";
            case PAUSED -> "pause the session";
            case ENDED -> "end the session";
            default -> "change the session status";
        };
    }
}
