package com.example.livesession.service;

import com.example.livesession.config.SessionProperties;
import com.example.livesession.model.CloseReason;
import com.example.livesession.model.Question;
import com.example.livesession.model.QuestionRound;
import com.example.livesession.model.QuestionType;
import com.example.livesession.model.Session;
import com.example.livesession.testsupport.ManualRoundScheduler;
import com.example.livesession.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QuestionRoundControllerTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private MutableClock clock;
    private ManualRoundScheduler scheduler;
    private QuestionRoundController controller;
    private Session session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new ManualRoundScheduler(clock);
        SessionProperties props = new SessionProperties();
        props.setDefaultTimeLimitSeconds(15);
        controller = new QuestionRoundController(scheduler, props);
        session = new Session("s1", "ABC234", "S", "boss", null, null, List.of(
                new Question("q1", QuestionType.WORD_CLOUD, "?", null, null, null, null, 0, 0, null, null),
                new Question("q2", QuestionType.WORD_CLOUD, "?", null, null, null, null, 0, 10, null, null)), T0);
    }

    @Test
    @DisplayName("questions without a limit get the configured default")
    void defaultLimit() {
        QuestionRound r = controller.activate(session, session.getQuestions().get(0), T0).round();
        assertEquals(15, r.getTimeLimitSeconds());
        assertEquals(T0.plusSeconds(15), r.deadline());
    }

    @Test
    @DisplayName("activating the open question returns it; another question while open is refused")
    void oneOpenRound() {
        QuestionRoundController.ActivationResult first = controller.activate(session, session.getQuestions().get(0), T0);
        QuestionRoundController.ActivationResult again = controller.activate(session, session.getQuestions().get(0), T0);

        assertTrue(first.created());
        assertFalse(again.created());
        assertSame(first.round(), again.round());
        assertThrows(IllegalStateException.class,
                () -> controller.activate(session, session.getQuestions().get(1), T0));
    }

    @Test
    @DisplayName("deadline fires once; close cancels it")
    void deadline() {
        QuestionRound r = controller.activate(session, session.getQuestions().get(1), T0).round();
        AtomicInteger fired = new AtomicInteger();
        controller.scheduleDeadline(r, T0, fired::incrementAndGet);

        assertTrue(controller.hasPendingDeadline(r.getId()));
        scheduler.advance(Duration.ofSeconds(10));
        assertEquals(1, fired.get());

        assertTrue(controller.close(r, CloseReason.TIMEOUT, clock.instant()));
        assertFalse(controller.close(r, CloseReason.ALL_RESPONDED, clock.instant()), "exactly once");
        assertFalse(controller.hasPendingDeadline(r.getId()));
    }

    @Test
    @DisplayName("pause cancels the timer, resume re-arms it for the remaining time")
    void pauseResume() {
        QuestionRound r = controller.activate(session, session.getQuestions().get(1), T0).round();
        AtomicInteger fired = new AtomicInteger();
        controller.scheduleDeadline(r, T0, fired::incrementAndGet);

        scheduler.advance(Duration.ofSeconds(4));
        controller.pause(r, clock.instant());
        scheduler.advance(Duration.ofSeconds(30));
        assertEquals(0, fired.get());

        Duration paused = controller.resume(r, clock.instant(), fired::incrementAndGet);
        assertEquals(Duration.ofSeconds(30), paused);
        scheduler.advance(Duration.ofSeconds(5));
        assertEquals(0, fired.get());
        scheduler.advance(Duration.ofSeconds(1));
        assertEquals(1, fired.get());
    }
}
