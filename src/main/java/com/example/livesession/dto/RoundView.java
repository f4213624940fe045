package com.example.livesession.dto;

import com.example.livesession.model.CloseReason;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.QuestionType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Client view of a round. {@code endsAt} is absolute; clients count down locally.
 * While paused {@code endsAt} still reflects the moment the pause started; use {@code remainingMillis}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundView(
        String roundId,
        String questionId,
        int index,
        int total,
        QuestionType questionType,
        QuestionView question,
        int points,
        int timeLimitSeconds,
        Instant activatedAt,
        Instant endsAt,
        long remainingMillis,
        boolean paused,
        boolean closed,
        CloseReason closeReason,
        int totalResponses
) {

    public static RoundView of(QuestionRound r, int total, Instant now) {
        return new RoundView(
                r.getId(),
                r.getQuestionId(),
                r.getIndex(),
                total,
                r.getType(),
                QuestionView.of(r.getQuestion()),
                r.getPointValue(),
                r.getTimeLimitSeconds(),
                r.getActivatedAt(),
                r.deadline(),
                r.remainingMillis(now),
                r.isPaused(),
                r.isClosed(),
                r.getCloseReason(),
                r.responseCount());
    }
}
