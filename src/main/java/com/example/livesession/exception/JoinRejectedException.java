package com.example.livesession.exception;

/** Session full, ended, or already running with late join disabled. */
public class JoinRejectedException extends SessionException {

    public JoinRejectedException(String message) {
        super(ErrorCode.SESSION_FULL, message);
    }
}
