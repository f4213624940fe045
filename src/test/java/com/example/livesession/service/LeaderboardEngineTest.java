package com.example.livesession.service;

import com.example.livesession.model.LeaderboardEntry;
import com.example.livesession.model.Participant;
import com.example.livesession.model.ParticipantResponse;
import com.example.livesession.model.ResponsePayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private final LeaderboardEngine engine = new LeaderboardEngine();

    private static Participant participant(String id, String name) {
        return new Participant(id, "s1", name, T0);
    }

    private static void answer(Participant p, int points, boolean correct, Instant at) {
        p.recordResponse(new ParticipantResponse(p.getId(), p.getDisplayName(), "s1", "r1", "q1",
                ResponsePayload.option("o1"), at, null, 1000, correct, points, 0, points, null), true);
    }

    @Test
    @DisplayName("higher score first; equal scores ordered by first correct answer")
    void ordering() {
        Participant a = participant("a", "Alice");
        Participant b = participant("b", "Bob");
        Participant c = participant("c", "Carol");
        answer(a, 500, true, T0.plusSeconds(9));
        answer(b, 500, true, T0.plusSeconds(3));
        answer(c, 900, true, T0.plusSeconds(5));

        List<LeaderboardEntry> board = engine.compute(List.of(a, b, c));

        assertEquals(List.of("Carol", "Bob", "Alice"),
                board.stream().map(LeaderboardEntry::displayName).toList());
        assertEquals(List.of(1, 2, 3), board.stream().map(LeaderboardEntry::rank).toList());
    }

    @Test
    @DisplayName("participants without correct answers share a rank, listed by name")
    void ties() {
        Participant z = participant("z", "zed");
        Participant y = participant("y", "Amy");

        List<LeaderboardEntry> board = engine.compute(List.of(z, y));

        assertEquals("Amy", board.get(0).displayName());
        assertEquals(1, board.get(0).rank());
        assertEquals(1, board.get(1).rank(), "same score and no correct answer means same rank");
    }

    @Test
    @DisplayName("top() trims, non-positive limit keeps everything")
    void top() {
        List<LeaderboardEntry> board = engine.compute(List.of(
                participant("a", "A"), participant("b", "B"), participant("c", "C")));

        assertEquals(2, engine.top(board, 2).size());
        assertEquals(3, engine.top(board, 0).size());
        assertTrue(engine.compute(List.of()).isEmpty());
    }

    @Test
    @DisplayName("accuracy and average response time come from recorded responses")
    void stats() {
        Participant a = participant("a", "Alice");
        answer(a, 100, true, T0.plusSeconds(1));
        answer(a, 0, false, T0.plusSeconds(2));

        LeaderboardEntry e = engine.compute(List.of(a)).get(0);

        assertEquals(100, e.score());
        assertEquals(50.0, e.accuracy());
        assertEquals(1.0, e.averageResponseTime());
    }
}
