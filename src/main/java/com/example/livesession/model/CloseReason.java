package com.example.livesession.model;

/** Why a question round stopped accepting responses. */
public enum CloseReason {
    TIMEOUT,
    ALL_RESPONDED,
    SKIPPED,
    SESSION_ENDED
}
