package com.example.livesession.dto;

import com.example.livesession.model.Participant;

import java.time.Instant;

public record ParticipantView(String id, String sessionId, String displayName, int score, boolean connected,
                              Instant joinedAt) {

    public static ParticipantView of(Participant p) {
        return new ParticipantView(p.getId(), p.getSessionId(), p.getDisplayName(), p.getScore(),
                p.isConnected(), p.getJoinedAt());
    }
}
