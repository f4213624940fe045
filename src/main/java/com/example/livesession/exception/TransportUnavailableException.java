package com.example.livesession.exception;

/** The connection is gone; nothing is queued, the client is expected to reconnect. */
public class TransportUnavailableException extends SessionException {

    public TransportUnavailableException(String connectionId, Throwable cause) {
        super(ErrorCode.TRANSPORT_UNAVAILABLE, "Connection " + connectionId + " is not available", cause);
    }
}
