package com.example.livesession.exception;

import com.example.livesession.model.SessionStatus;

public class InvalidTransitionException extends SessionException {

    private final SessionStatus currentStatus;
    private final SessionStatus requestedStatus;

    public InvalidTransitionException(SessionStatus currentStatus, SessionStatus requestedStatus) {
        super(ErrorCode.INVALID_TRANSITION,
                String.format("Cannot move session from %s to %s", wire(currentStatus), wire(requestedStatus)));
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public InvalidTransitionException(SessionStatus currentStatus, String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
        this.currentStatus = currentStatus;
        this.requestedStatus = null;
    }

    public SessionStatus getCurrentStatus() {
        return currentStatus;
    }

    public SessionStatus getRequestedStatus() {
        return requestedStatus;
    }

    private static String wire(SessionStatus s) {
        return s == null ? "null" : s.wireName();
    }
}
