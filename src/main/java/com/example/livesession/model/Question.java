package com.example.livesession.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A question as supplied by the question bank, including its answer key.
 * The answer part never leaves the server before the round closes; see {@link #participantOptions()}.
 */
public record Question(
        String id,
        QuestionType type,
        String text,
        List<QuestionOption> options,
        List<String> acceptedAnswers,
        GeoPoint target,
        Double acceptanceRadiusMeters,
        int points,
        int timeLimitSeconds,
        String hintText,
        String explanation
) {

    public Question {
        options = (options == null) ? List.of() : List.copyOf(options);
        acceptedAnswers = (acceptedAnswers == null) ? List.of() : List.copyOf(acceptedAnswers);
    }

    public Question withTimeLimit(int seconds) {
        return new Question(id, type, text, options, acceptedAnswers, target, acceptanceRadiusMeters,
                points, seconds, hintText, explanation);
    }

    public Set<String> correctOptionIds() {
        Set<String> out = new LinkedHashSet<>();
        for (QuestionOption o : options) {
            if (o.correct()) out.add(o.id());
        }
        return out;
    }

    /** Options in display order without the correctness flag. */
    public List<QuestionOption> participantOptions() {
        List<QuestionOption> out = new ArrayList<>();
        for (QuestionOption o : options) {
            out.add(new QuestionOption(o.id(), o.text(), false, o.displayOrder()));
        }
        out.sort(Comparator.comparingInt(QuestionOption::displayOrder));
        return out;
    }

    /** Human readable correct answer, or null when the type has none (word cloud). */
    public String correctAnswerDisplay() {
        switch (type) {
            case MULTIPLE_CHOICE:
            case TRUE_FALSE:
                return options.stream()
                        .filter(QuestionOption::correct)
                        .map(QuestionOption::text)
                        .collect(Collectors.joining(", "));
            case SHORT_ANSWER:
                return acceptedAnswers.isEmpty() ? null : acceptedAnswers.get(0);
            case PIN_ON_MAP:
                if (target == null) return null;
                return String.format(Locale.ROOT, "%.6f, %.6f (±%.0f m)",
                        target.latitude(), target.longitude(),
                        acceptanceRadiusMeters == null ? 0d : acceptanceRadiusMeters);
            default:
                return null;
        }
    }
}
