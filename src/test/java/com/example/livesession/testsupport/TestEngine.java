package com.example.livesession.testsupport;

import com.example.livesession.config.SessionProperties;
import com.example.livesession.dto.CreateSessionRequest;
import com.example.livesession.dto.CreateSessionRequest.OptionInput;
import com.example.livesession.dto.CreateSessionRequest.QuestionInput;
import com.example.livesession.dto.CreatedSession;
import com.example.livesession.model.QuestionType;
import com.example.livesession.model.SessionSettings;
import com.example.livesession.persistence.NoOpSessionArchive;
import com.example.livesession.persistence.SessionArchive;
import com.example.livesession.security.PresenterKeyHasher;
import com.example.livesession.service.AnswerEvaluator;
import com.example.livesession.service.BroadcastCoordinator;
import com.example.livesession.service.ExactAnswerMatcher;
import com.example.livesession.service.LeaderboardEngine;
import com.example.livesession.service.LiveSessionService;
import com.example.livesession.service.QuestionRoundController;
import com.example.livesession.service.ResponseScorer;
import com.example.livesession.service.SessionAnalytics;
import com.example.livesession.service.SessionCodeGenerator;
import com.example.livesession.service.SessionRegistry;
import com.example.livesession.service.SessionStateMachine;
import com.example.livesession.sessions.service.SessionSnapshotter;
import com.example.livesession.sessions.store.InMemorySessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fully wired engine on a manual clock and scheduler, without Spring.
 */
public class TestEngine {

    public static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    public final MutableClock clock = new MutableClock(T0);
    public final ManualRoundScheduler scheduler = new ManualRoundScheduler(clock);
    public final RecordingTransport transport = new RecordingTransport();
    public final ObjectMapper mapper = TestJson.mapper();
    public final SessionProperties props = new SessionProperties();
    public final SessionRegistry registry = new SessionRegistry();
    public final InMemorySessionStore store = new InMemorySessionStore();
    public final LiveSessionService service;

    public TestEngine() {
        this(new NoOpSessionArchive());
    }

    public TestEngine(SessionArchive archive) {
        this.service = new LiveSessionService(
                registry,
                new SessionCodeGenerator(props),
                new SessionStateMachine(),
                new QuestionRoundController(scheduler, props),
                new AnswerEvaluator(new ExactAnswerMatcher()),
                new ResponseScorer(),
                new LeaderboardEngine(),
                new BroadcastCoordinator(transport, mapper),
                new SessionAnalytics(),
                new PresenterKeyHasher(),
                store,
                archive,
                props,
                clock,
                (SessionSnapshotter) null);
    }

    public CreatedSession create(SessionSettings settings, QuestionInput... questions) {
        return service.createSession(new CreateSessionRequest("Geography 101", settings, List.of(questions)));
    }

    public CreatedSession create(QuestionInput... questions) {
        return create(SessionSettings.defaults(), questions);
    }

    /** Event envelopes broadcast to the whole session group, in order. */
    public List<JsonNode> events(String sessionId) {
        List<JsonNode> out = new ArrayList<>();
        String group = BroadcastCoordinator.groupFor(sessionId);
        for (String[] b : transport.broadcasts()) {
            if (group.equals(b[0])) out.add(parse(b[1]));
        }
        return out;
    }

    public List<String> eventTypes(String sessionId) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : events(sessionId)) out.add(n.get("type").asText());
        return out;
    }

    public long count(String sessionId, String type) {
        return eventTypes(sessionId).stream().filter(type::equals).count();
    }

    public JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    // --- question builders ---

    /** Options o1..oN, the one at {@code correctIndex} is correct. */
    public static QuestionInput multipleChoice(String id, int points, int seconds, int correctIndex, String... options) {
        List<OptionInput> opts = new ArrayList<>();
        for (int i = 0; i < options.length; i++) {
            opts.add(new OptionInput("o" + (i + 1), options[i], i == correctIndex, i));
        }
        return new QuestionInput(id, QuestionType.MULTIPLE_CHOICE, "Question " + id, opts, null,
                null, null, null, points, seconds, null, "Because.");
    }

    public static QuestionInput shortAnswer(String id, int points, int seconds, String... accepted) {
        return new QuestionInput(id, QuestionType.SHORT_ANSWER, "Short " + id, null, List.of(accepted),
                null, null, null, points, seconds, null, null);
    }

    public static QuestionInput wordCloud(String id, int seconds) {
        return new QuestionInput(id, QuestionType.WORD_CLOUD, "One word " + id, null, null,
                null, null, null, null, seconds, null, null);
    }

    public static QuestionInput pinOnMap(String id, int points, int seconds, double lat, double lng, double radius) {
        return new QuestionInput(id, QuestionType.PIN_ON_MAP, "Where is " + id + "?", null, null,
                lat, lng, radius, points, seconds, null, null);
    }
}
