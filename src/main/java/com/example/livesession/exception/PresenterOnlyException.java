package com.example.livesession.exception;

/** A presenter-only command was sent by somebody else. */
public class PresenterOnlyException extends SessionException {

    public PresenterOnlyException(String action) {
        super(ErrorCode.FORBIDDEN, "Only the presenter may " + action);
    }
}
