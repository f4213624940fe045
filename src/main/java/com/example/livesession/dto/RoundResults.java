package com.example.livesession.dto;

import com.example.livesession.model.CloseReason;
import com.example.livesession.model.QuestionType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregates of one round. {@code correctAnswer} and per-response correctness stay null
 * while the round is open.
 *
 * @param optionCounts option id → number of picks, choice questions only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundResults(
        String roundId,
        String questionId,
        String questionText,
        QuestionType questionType,
        int index,
        boolean closed,
        CloseReason closeReason,
        Instant activatedAt,
        Instant closedAt,
        int totalResponses,
        int correctResponses,
        Double correctRate,
        Double averageResponseSeconds,
        Map<String, Integer> optionCounts,
        String correctAnswer,
        List<ResponseRow> responses
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseRow(String participantId, String displayName, Boolean correct, int pointsAwarded,
                              double responseSeconds, Double distanceMeters) { }
}
