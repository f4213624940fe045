package com.example.livesession.exception;

import org.springframework.http.HttpStatus;

/** Error kinds shared by the REST and WebSocket surfaces. */
public enum ErrorCode {

    INVALID_TRANSITION(HttpStatus.CONFLICT),
    ROUND_CLOSED(HttpStatus.CONFLICT),
    ALREADY_SUBMITTED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    SESSION_FULL(HttpStatus.CONFLICT),
    INVALID_COMMAND(HttpStatus.BAD_REQUEST),
    TRANSPORT_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
