package com.example.livesession.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a submission, sent to the submitter only.
 * {@code correctAnswer} is null when the session hides correct answers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerFeedback(
        @JsonProperty("isCorrect") boolean correct,
        int pointsAwarded,
        int speedBonus,
        String correctAnswer,
        String explanation,
        Double distanceMeters
) {
}
