package com.example.livesession.exception;

import java.util.Objects;

/** Base of every rejected command. Never fatal to the session it concerns. */
public class SessionException extends RuntimeException {

    private final ErrorCode code;

    public SessionException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public SessionException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }
}
