package com.example.livesession.dto;

/** @param waitingForStart true while the session is still Pending */
public record JoinResult(ParticipantView participant, SessionView session, boolean waitingForStart,
                         SessionSnapshot state) { }
