package com.example.livesession.exception;

public class RoundClosedException extends SessionException {

    public RoundClosedException(String message) {
        super(ErrorCode.ROUND_CLOSED, message);
    }

    public static RoundClosedException forRound(String roundId) {
        return new RoundClosedException("Round " + roundId + " is not accepting responses");
    }
}
