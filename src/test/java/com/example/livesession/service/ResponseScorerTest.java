package com.example.livesession.service;

import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.QuestionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseScorerTest {

    private final ResponseScorer scorer = new ResponseScorer();

    private static QuestionRound round(int points, int seconds) {
        Question q = new Question("q1", QuestionType.SHORT_ANSWER, "?", null, List.of("x"), null, null,
                points, seconds, null, null);
        return new QuestionRound("r1", "s1", q, 0, Instant.parse("2026-01-05T09:00:00Z"));
    }

    @Test
    @DisplayName("1000 points, 20 s limit, answered at 5 s gives 1375")
    void speedBonus() {
        ResponseScorer.Score s = scorer.score(round(1000, 20), true, 5_000, true);
        assertEquals(1000, s.basePoints());
        assertEquals(375, s.speedBonus());
        assertEquals(1375, s.total());
    }

    @Test
    @DisplayName("wrong answers score zero, bonus included")
    void wrong() {
        assertEquals(0, scorer.score(round(1000, 20), false, 1_000, true).total());
    }

    @Test
    @DisplayName("answering at the deadline leaves no bonus; elapsed is clamped")
    void atDeadline() {
        ResponseScorer.Score s = scorer.score(round(1000, 20), true, 25_000, true);
        assertEquals(0, s.speedBonus());
        assertEquals(20_000, s.elapsedMillis());
    }

    @Test
    @DisplayName("extensions widen the bonus window")
    void extension() {
        QuestionRound r = round(1000, 20);
        r.extend(20_000);
        assertEquals(375, scorer.score(r, true, 10_000, true).speedBonus());
    }

    @Test
    @DisplayName("speed bonus can be disabled")
    void disabled() {
        assertEquals(1000, scorer.score(round(1000, 20), true, 0, false).total());
    }
}
