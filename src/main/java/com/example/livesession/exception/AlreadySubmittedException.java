package com.example.livesession.exception;

public class AlreadySubmittedException extends SessionException {

    public AlreadySubmittedException(String participantId, String roundId) {
        super(ErrorCode.ALREADY_SUBMITTED,
                String.format("Participant %s already answered round %s", participantId, roundId));
    }
}
