package com.example.livesession.service;

import com.example.livesession.exception.InvalidCommandException;
import com.example.livesession.model.GeoPoint;
import com.example.livesession.model.Question;
import com.example.livesession.model.ResponsePayload;
import org.springframework.stereotype.Component;

/**
 * Correctness of a payload against a question's answer key.
 * A payload that does not fit the question type is rejected as an invalid command.
 */
@Component
public class AnswerEvaluator {

    private final AnswerMatcher matcher;

    public AnswerEvaluator(AnswerMatcher matcher) {
        this.matcher = matcher;
    }

    public Evaluation evaluate(Question question, ResponsePayload payload) {
        if (payload == null) throw new InvalidCommandException("Response payload is required");

        switch (question.type()) {
            case MULTIPLE_CHOICE:
            case TRUE_FALSE: {
                String optionId = payload.optionId();
                if (optionId == null || optionId.isBlank()) {
                    throw new InvalidCommandException("optionId is required for " + question.type().wireName());
                }
                return new Evaluation(question.correctOptionIds().contains(optionId.trim()), null);
            }
            case SHORT_ANSWER: {
                requireText(payload, question);
                return new Evaluation(matcher.matches(payload.text(), question.acceptedAnswers()), null);
            }
            case WORD_CLOUD: {
                requireText(payload, question);
                return new Evaluation(true, null);
            }
            case PIN_ON_MAP: {
                if (!payload.hasCoordinate()) {
                    throw new InvalidCommandException("latitude and longitude are required for PinOnMap");
                }
                GeoPoint pin;
                try {
                    pin = payload.coordinate();
                } catch (IllegalArgumentException e) {
                    throw new InvalidCommandException(e.getMessage(), e);
                }
                if (question.target() == null) return new Evaluation(false, null);
                double distance = GeoDistance.haversineMeters(pin, question.target());
                double radius = question.acceptanceRadiusMeters() == null ? 0d : question.acceptanceRadiusMeters();
                return new Evaluation(distance <= radius, distance);
            }
            default:
                throw new InvalidCommandException("Unsupported question type " + question.type());
        }
    }

    private static void requireText(ResponsePayload payload, Question question) {
        if (payload.text() == null || payload.text().isBlank()) {
            throw new InvalidCommandException("text is required for " + question.type().wireName());
        }
    }

    /** @param distanceMeters pin-on-map only */
    public record Evaluation(boolean correct, Double distanceMeters) { }
}
