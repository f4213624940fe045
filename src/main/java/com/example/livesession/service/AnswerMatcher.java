package com.example.livesession.service;

import java.util.List;

/** Decides whether a short-answer text matches one of the accepted answers. */
public interface AnswerMatcher {

    boolean matches(String submitted, List<String> acceptedAnswers);
}
