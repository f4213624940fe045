package com.example.livesession.exception;

public class InvalidCommandException extends SessionException {

    public InvalidCommandException(String message) {
        super(ErrorCode.INVALID_COMMAND, message);
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(ErrorCode.INVALID_COMMAND, message, cause);
    }
}
