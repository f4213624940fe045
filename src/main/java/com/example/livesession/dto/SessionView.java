package com.example.livesession.dto;

import com.example.livesession.model.Session;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.model.SessionStatus;

import java.time.Instant;

public record SessionView(
        String id,
        String code,
        String name,
        SessionStatus status,
        SessionSettings settings,
        int totalQuestions,
        int currentQuestionIndex,
        int participantCount,
        int connectedCount,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        long seq
) {

    public static SessionView of(Session s) {
        return new SessionView(
                s.getId(),
                s.getCode(),
                s.getName(),
                s.getStatus(),
                s.getSettings().copy(),
                s.getQuestions().size(),
                s.getCurrentIndex(),
                s.participants().size(),
                s.participants().connectedCount(),
                s.getCreatedAt(),
                s.getStartedAt(),
                s.getEndedAt(),
                s.getSeq());
    }
}
