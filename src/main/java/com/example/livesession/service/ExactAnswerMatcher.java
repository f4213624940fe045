package com.example.livesession.service;

import org.springframework.stereotype.Component;

import java.util.List;

/** Trimmed, case-insensitive equality. */
@Component
public class ExactAnswerMatcher implements AnswerMatcher {

    @Override
    public boolean matches(String submitted, List<String> acceptedAnswers) {
        if (submitted == null || acceptedAnswers == null) return false;
        String s = submitted.trim();
        if (s.isEmpty()) return false;
        for (String accepted : acceptedAnswers) {
            if (accepted != null && s.equalsIgnoreCase(accepted.trim())) return true;
        }
        return false;
    }
}
