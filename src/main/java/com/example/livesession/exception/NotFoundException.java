package com.example.livesession.exception;

public class NotFoundException extends SessionException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException session(String idOrCode) {
        return new NotFoundException("Session " + idOrCode + " not found");
    }

    public static NotFoundException participant(String participantId) {
        return new NotFoundException("Participant " + participantId + " not found");
    }

    public static NotFoundException round(String roundId) {
        return new NotFoundException("Round " + roundId + " not found");
    }

    public static NotFoundException question(String questionId) {
        return new NotFoundException("Question " + questionId + " not found");
    }
}
